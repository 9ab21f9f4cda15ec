package com.filmdb.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.filmdb.entity.Actor;
import com.filmdb.entity.ActorAward;
import com.filmdb.entity.Crew;
import com.filmdb.entity.Director;
import com.filmdb.entity.Distributes;
import com.filmdb.entity.Distributor;
import com.filmdb.entity.Equipment;
import com.filmdb.entity.Film;
import com.filmdb.entity.FilmCrewEquipment;
import com.filmdb.entity.ProducedBy;
import com.filmdb.entity.Producer;
import com.filmdb.entity.Role;
import com.filmdb.entity.SceneFilming;
import com.filmdb.entity.WorksOn;
import com.filmdb.entity.dto.ActorAwardHistoryDTO;
import com.filmdb.entity.dto.ActorFilmographyEntryDTO;
import com.filmdb.entity.dto.BoxOfficeEntryDTO;
import com.filmdb.entity.dto.CrewPayrollEntryDTO;
import com.filmdb.entity.dto.DirectorFilmographyEntryDTO;
import com.filmdb.entity.dto.DistributorPerformanceDTO;
import com.filmdb.entity.dto.EquipmentUsageReportEntryDTO;
import com.filmdb.entity.dto.FilmProductionSummaryDTO;
import com.filmdb.entity.dto.ProducerInvestmentSummaryDTO;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.repository.ActorAwardRepository;
import com.filmdb.repository.ActorRepository;
import com.filmdb.repository.CrewRepository;
import com.filmdb.repository.DirectorRepository;
import com.filmdb.repository.DistributesRepository;
import com.filmdb.repository.DistributorRepository;
import com.filmdb.repository.EquipmentRepository;
import com.filmdb.repository.FilmCrewEquipmentRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.ProducedByRepository;
import com.filmdb.repository.ProducerRepository;
import com.filmdb.repository.RoleRepository;
import com.filmdb.repository.SceneFilmingRepository;
import com.filmdb.repository.SceneRepository;
import com.filmdb.repository.ShotAtRepository;
import com.filmdb.repository.WorksOnRepository;

/**
 * Lesende Auswertungen über Filme, Besetzung, Produzenten, Crew und Verleiher.
 */
@ApplicationScoped
public class ReportService {

	@Inject
	FilmRepository filmRepository;

	@Inject
	DirectorRepository directorRepository;

	@Inject
	ActorRepository actorRepository;

	@Inject
	ProducerRepository producerRepository;

	@Inject
	CrewRepository crewRepository;

	@Inject
	DistributorRepository distributorRepository;

	@Inject
	RoleRepository roleRepository;

	@Inject
	SceneRepository sceneRepository;

	@Inject
	WorksOnRepository worksOnRepository;

	@Inject
	ShotAtRepository shotAtRepository;

	@Inject
	ProducedByRepository producedByRepository;

	@Inject
	SceneFilmingRepository sceneFilmingRepository;

	@Inject
	DistributesRepository distributesRepository;

	@Inject
	EquipmentRepository equipmentRepository;

	@Inject
	FilmCrewEquipmentRepository crewEquipmentRepository;

	@Inject
	ActorAwardRepository actorAwardRepository;

	public FilmProductionSummaryDTO productionSummary(Integer filmId) {
		Film film = filmRepository.findById(filmId).orElseThrow(() -> RecordNotFoundException.of("Film", filmId));
		return new FilmProductionSummaryDTO(
				film.getId(),
				film.getTitle(),
				film.getProductionStatus(),
				film.getBudget(),
				film.getDuration(),
				directorName(film.getDirectorId()),
				roleRepository.countDistinctActorsByFilmId(filmId),
				sceneRepository.countByFilmId(filmId),
				worksOnRepository.countDistinctCrewByFilmId(filmId),
				shotAtRepository.countDistinctLocationsByFilmId(filmId));
	}

	/**
	 * Alle Rollen eines Schauspielers, neueste Veröffentlichung zuerst; Filme ohne Datum am Ende.
	 */
	public List<ActorFilmographyEntryDTO> actorFilmography(Integer actorId) {
		if (!actorRepository.existsById(actorId))
			throw RecordNotFoundException.of("Actor", actorId);
		return roleRepository.findByActorId(actorId).stream()
				.map(role -> toFilmographyEntry(role, filmRepository.findById(role.getFilmId()).orElse(null)))
				.filter(Objects::nonNull)
				.sorted(Comparator.comparing(ActorFilmographyEntryDTO::releaseDate,
						Comparator.nullsLast(Comparator.reverseOrder())))
				.collect(Collectors.toList());
	}

	public List<DirectorFilmographyEntryDTO> directorFilmography(Integer directorId) {
		if (!directorRepository.existsById(directorId))
			throw RecordNotFoundException.of("Director", directorId);
		return filmRepository.findByDirectorId(directorId).stream()
				.sorted(Comparator.comparing(Film::getReleaseDate, Comparator.nullsLast(Comparator.reverseOrder())))
				.map(film -> new DirectorFilmographyEntryDTO(
						film.getId(),
						film.getTitle(),
						film.getReleaseDate(),
						film.getBudget(),
						film.getBoxOfficeCollection(),
						FilmMetricsService.profitOf(film),
						FilmMetricsService.roiOf(film),
						film.getRating(),
						film.getProductionStatus()))
				.collect(Collectors.toList());
	}

	public ProducerInvestmentSummaryDTO producerInvestment(Integer producerId) {
		Producer producer = producerRepository.findById(producerId)
				.orElseThrow(() -> RecordNotFoundException.of("Producer", producerId));
		List<ProducedBy> shares = producedByRepository.findByProducerId(producerId);
		List<BigDecimal> investments = shares.stream()
				.map(ProducedBy::getInvestment)
				.filter(Objects::nonNull)
				.collect(Collectors.toList());
		long filmCount = shares.stream()
				.map(ProducedBy::getFilmId)
				.distinct()
				.count();
		BigDecimal total = investments.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
		BigDecimal average = average(investments);
		return new ProducerInvestmentSummaryDTO(
				producer.getId(),
				producer.getName(),
				producer.getCompany(),
				filmCount,
				total,
				average,
				investments.stream().max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO),
				investments.stream().min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO));
	}

	/**
	 * Einsätze der Crew eines Films. Arbeitstage zählen Start- und Endtag mit; Drehs und Minuten stammen aus
	 * den Drehprotokollen desselben Films.
	 */
	public List<CrewPayrollEntryDTO> crewPayroll(Integer filmId) {
		if (!filmRepository.existsById(filmId))
			throw RecordNotFoundException.of("Film", filmId);
		return worksOnRepository.findByFilmId(filmId).stream()
				.map(worksOn -> toPayrollEntry(worksOn, crewRepository.findById(worksOn.getCrewId()).orElse(null)))
				.filter(Objects::nonNull)
				.collect(Collectors.toList());
	}

	/**
	 * Filme mit Einspielergebnis, absteigend nach Einspielergebnis.
	 */
	public List<BoxOfficeEntryDTO> boxOfficeAnalysis() {
		return filmRepository.findWithBoxOffice().stream()
				.map(film -> new BoxOfficeEntryDTO(
						film.getId(),
						film.getTitle(),
						film.getReleaseDate(),
						film.getBudget(),
						film.getBoxOfficeCollection(),
						FilmMetricsService.profitOf(film),
						FilmMetricsService.roiOf(film),
						directorName(film.getDirectorId()),
						roleRepository.countDistinctActorsByFilmId(film.getId())))
				.collect(Collectors.toList());
	}

	/**
	 * Verleiher absteigend nach Summe der Vertriebsgebühren.
	 */
	public List<DistributorPerformanceDTO> distributorPerformance() {
		return distributorRepository.listAll().stream()
				.map(this::toPerformance)
				.sorted(Comparator.comparing(DistributorPerformanceDTO::totalFees).reversed())
				.collect(Collectors.toList());
	}

	/**
	 * Equipment-Zuordnungen der Crew eines Films, nach Equipment und Crew sortiert. Häufigkeit und Anzahl der
	 * Crew-Mitglieder stammen aus den Drehprotokollen des Films.
	 */
	public List<EquipmentUsageReportEntryDTO> equipmentUsageReport(Integer filmId) {
		if (!filmRepository.existsById(filmId))
			throw RecordNotFoundException.of("Film", filmId);
		Map<Integer, List<SceneFilming>> filmingsByEquipment = sceneFilmingRepository.findByFilmId(filmId).stream()
				.filter(filming -> filming.getEquipmentId() != null)
				.collect(Collectors.groupingBy(SceneFilming::getEquipmentId));
		return crewEquipmentRepository.findByFilmId(filmId).stream()
				.sorted(Comparator.comparing(FilmCrewEquipment::getEquipmentId)
						.thenComparing(FilmCrewEquipment::getCrewId))
				.map(assignment -> toUsageEntry(assignment,
						equipmentRepository.findById(assignment.getEquipmentId()).orElse(null),
						filmingsByEquipment.getOrDefault(assignment.getEquipmentId(), List.of())))
				.filter(Objects::nonNull)
				.collect(Collectors.toList());
	}

	public ActorAwardHistoryDTO actorAwardHistory(Integer actorId) {
		Actor actor = actorRepository.findById(actorId).orElseThrow(() -> RecordNotFoundException.of("Actor", actorId));
		List<ActorAwardHistoryDTO.AwardEntry> awards = actorAwardRepository.findByRecipientId(actorId).stream()
				.sorted(Comparator.comparing(ActorAward::getAwardYear, Comparator.reverseOrder())
						.thenComparing(ActorAward::getAwardName))
				.map(award -> new ActorAwardHistoryDTO.AwardEntry(award.getAwardName(), award.getAwardYear()))
				.collect(Collectors.toList());
		return new ActorAwardHistoryDTO(
				actor.getId(),
				actor.getFirstName(),
				actor.getLastName(),
				actor.getNationality(),
				awards.size(),
				awards);
	}

	private static EquipmentUsageReportEntryDTO toUsageEntry(FilmCrewEquipment assignment, Equipment equipment,
			List<SceneFilming> filmings) {
		if (equipment == null)
			return null;
		return new EquipmentUsageReportEntryDTO(
				equipment.getId(),
				equipment.getName(),
				equipment.getType(),
				equipment.getCost(),
				assignment.getCrewId(),
				assignment.getDaysUsed(),
				assignment.getEfficiencyRating(),
				assignment.isMaintenanceRequired(),
				filmings.size(),
				filmings.stream().map(SceneFilming::getCrewId).distinct().count());
	}

	private DistributorPerformanceDTO toPerformance(Distributor distributor) {
		List<Distributes> deals = distributesRepository.findByDistributorId(distributor.getId());
		BigDecimal fees = deals.stream()
				.map(Distributes::getDistributionFee)
				.filter(Objects::nonNull)
				.reduce(BigDecimal.ZERO, BigDecimal::add);
		Map<Integer, Film> films = deals.stream()
				.map(Distributes::getFilmId)
				.distinct()
				.map(id -> filmRepository.findById(id).orElse(null))
				.filter(Objects::nonNull)
				.collect(Collectors.toMap(Film::getId, Function.identity()));
		List<BigDecimal> collections = films.values().stream()
				.map(Film::getBoxOfficeCollection)
				.filter(Objects::nonNull)
				.collect(Collectors.toList());
		BigDecimal averageBoxOffice = average(collections);
		return new DistributorPerformanceDTO(
				distributor.getId(),
				distributor.getName(),
				distributor.getRegion(),
				distributor.getMarketShare(),
				films.size(),
				fees,
				averageBoxOffice);
	}

	private ActorFilmographyEntryDTO toFilmographyEntry(Role role, Film film) {
		if (film == null)
			return null;
		return new ActorFilmographyEntryDTO(
				film.getId(),
				film.getTitle(),
				film.getReleaseDate(),
				film.getDuration(),
				film.getLanguage(),
				role.getCharacterName(),
				role.getScreenTime(),
				role.getImportance(),
				role.getSalary(),
				directorName(film.getDirectorId()));
	}

	private CrewPayrollEntryDTO toPayrollEntry(WorksOn worksOn, Crew crew) {
		if (crew == null)
			return null;
		List<SceneFilming> filmings = sceneFilmingRepository.findByFilmIdAndCrewId(worksOn.getFilmId(),
				crew.getId());
		long workingDays = worksOn.getStartDate() == null || worksOn.getEndDate() == null ? 0
				: ChronoUnit.DAYS.between(worksOn.getStartDate(), worksOn.getEndDate()) + 1;
		long minutes = filmings.stream()
				.map(SceneFilming::getDurationMinutes)
				.filter(Objects::nonNull)
				.mapToLong(Integer::longValue)
				.sum();
		return new CrewPayrollEntryDTO(
				crew.getId(),
				crew.getName(),
				crew.getJobTitle(),
				crew.getDepartment(),
				worksOn.getStartDate(),
				worksOn.getEndDate(),
				workingDays,
				filmings.size(),
				minutes);
	}

	/**
	 * Durchschnitt auf zwei Stellen; fehlende Werte sind bereits herausgefiltert, ohne Werte 0.
	 */
	private static BigDecimal average(List<BigDecimal> values) {
		if (values.isEmpty())
			return BigDecimal.ZERO;
		return values.stream()
				.reduce(BigDecimal.ZERO, BigDecimal::add)
				.divide(BigDecimal.valueOf(values.size()), 2, RoundingMode.HALF_UP);
	}

	private String directorName(Integer directorId) {
		return directorRepository.findById(directorId).map(Director::getName).orElse(null);
	}
}
