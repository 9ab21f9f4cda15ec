package com.filmdb.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import com.filmdb.entity.Availability;
import com.filmdb.entity.Crew;
import com.filmdb.entity.Equipment;
import com.filmdb.entity.Film;
import com.filmdb.entity.Importance;
import com.filmdb.entity.ProductionStatus;
import com.filmdb.entity.Role;
import com.filmdb.entity.ShootingLocation;
import com.filmdb.entity.ShotAt;
import com.filmdb.entity.UserAccount;
import com.filmdb.entity.UserRole;
import com.filmdb.entity.WorksOn;
import com.filmdb.entity.dto.OperationResultDTO;
import com.filmdb.entity.dto.ShootingLocationResultDTO;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.ShootingLocationRepository;

/**
 * Zusammengesetzte Geschäftsoperationen der Produktionsplanung.
 * <p>
 * Jede Operation läuft in genau einer Transaktion: Eingaben auflösen, prüfen, schreiben, auditieren. Schlägt ein
 * Schritt fehl, bleibt weder ein Datensatz noch ein Audit-Eintrag zurück.
 */
@ApplicationScoped
public class ProductionOperationsService {

	private static final Logger LOG = Logger.getLogger(ProductionOperationsService.class);

	@Inject
	FilmRepository filmRepository;

	@Inject
	ShootingLocationRepository locationRepository;

	@Inject
	FilmService filmService;

	@Inject
	PeopleService peopleService;

	@Inject
	AssetService assetService;

	@Inject
	CastingService castingService;

	@Inject
	ProductionLinkService productionLinkService;

	@Inject
	AccessControlService accessControlService;

	@Inject
	ValidationService validationService;

	@Inject
	AuditService auditService;

	/**
	 * Besetzt eine Rolle. Die Leinwandzeit beginnt bei 0.
	 */
	@Transactional
	public Role castActorInFilm(Integer actorId, Integer filmId, String characterName, Importance importance,
			BigDecimal salary) {
		Role role = new Role();
		role.setActorId(actorId);
		role.setFilmId(filmId);
		role.setCharacterName(characterName);
		role.setScreenTime(0);
		role.setImportance(importance == null ? Importance.SUPPORTING : importance);
		role.setSalary(salary == null ? BigDecimal.ZERO : salary);
		return castingService.castRole(role);
	}

	/**
	 * Teilt ein Crew-Mitglied einem Film zu. Die Abteilung wird aus dem Crew-Datensatz übernommen.
	 */
	@Transactional
	public WorksOn allocateCrewToFilm(Integer crewId, Integer filmId, LocalDate startDate, LocalDate endDate) {
		Crew crew = peopleService.getCrew(crewId);
		WorksOn worksOn = new WorksOn();
		worksOn.setCrewId(crew.getId());
		worksOn.setFilmId(filmId);
		worksOn.setStartDate(startDate);
		worksOn.setEndDate(endDate);
		worksOn.setDepartment(crew.getDepartment());
		return productionLinkService.assignCrew(worksOn);
	}

	/**
	 * Bucht einen Drehort. Ein vorhandener Drehort mit gleichem Namen und gleicher Stadt wird wiederverwendet,
	 * sonst neu angelegt. Die Kosten ergeben sich aus Tagessatz mal Drehtagen, Start- und Endtag eingeschlossen.
	 */
	@Transactional
	public ShootingLocationResultDTO addShootingLocation(Integer filmId, String name, String city, String country,
			LocalDate shootingStart, LocalDate shootingEnd, BigDecimal costPerDay) {
		ShotAt shotAt = new ShotAt();
		shotAt.setFilmId(filmId);
		shotAt.setShootingStart(shootingStart);
		shotAt.setShootingEnd(shootingEnd);
		validationService.validateShotAt(shotAt);
		if (!filmRepository.existsById(filmId))
			throw RecordNotFoundException.of("Film", filmId);

		BigDecimal dailyCost = costPerDay == null ? BigDecimal.ZERO : costPerDay;
		ShootingLocation candidate = newLocation(name, city, country, dailyCost);
		validationService.validateShootingLocation(candidate);
		ShootingLocation location = locationRepository.findByNameAndCity(name, city)
				.orElseGet(() -> assetService.createLocation(candidate));

		long totalDays = ChronoUnit.DAYS.between(shootingStart, shootingEnd) + 1;
		BigDecimal totalCost = dailyCost.multiply(BigDecimal.valueOf(totalDays));
		shotAt.setLocationId(location.getId());
		shotAt.setTotalCost(totalCost);
		productionLinkService.bookLocation(shotAt);

		LOG.infof("Booked location %d for film %d: %d days, cost %s", location.getId(), filmId, totalDays,
				totalCost);
		return new ShootingLocationResultDTO(location.getId(), totalDays, totalCost);
	}

	/**
	 * Setzt den Produktionsstatus. Der Weg über die Film-Aktualisierung schreibt STATUS_CHANGE, die Operation
	 * selbst zusätzlich STATUS_UPDATE; beide Einträge bleiben erhalten.
	 */
	@Transactional
	public OperationResultDTO updateProductionStatus(Integer filmId, ProductionStatus newStatus) {
		ProductionStatus oldStatus = filmService.getFilm(filmId).getProductionStatus();
		Film film = filmService.changeProductionStatus(filmId, newStatus);
		auditService.recordStatusUpdate(film, oldStatus);
		String message = "Film status updated from " + oldStatus.getLabel() + " to " + newStatus.getLabel();
		LOG.info(message);
		return new OperationResultDTO(message);
	}

	@Transactional
	public OperationResultDTO updateEquipmentStatus(Integer equipmentId, Availability availability) {
		Equipment equipment = assetService.changeAvailability(equipmentId, availability);
		return new OperationResultDTO(
				"Equipment " + equipment.getId() + " status updated to " + equipment.getAvailability());
	}

	/**
	 * Legt einen Film in der Vorproduktion samt Genres an. Leere Einträge werden übersprungen, doppelte ignoriert;
	 * das erste Genre wird Hauptgenre.
	 */
	@Transactional
	public Film addFilmWithGenres(String title, BigDecimal budget, Integer duration, Integer directorId,
			String language, String genres) {
		Set<String> genreNames = splitGenres(genres);
		String primaryGenre = genreNames.stream().findFirst().orElse(null);

		Film film = new Film();
		film.setTitle(title);
		film.setBudget(budget);
		film.setDuration(duration);
		film.setDirectorId(directorId);
		film.setLanguage(language);
		film.setPrimaryGenre(primaryGenre);
		film.setProductionStatus(ProductionStatus.PRE_PRODUCTION);
		filmService.createFilm(film);

		for (String genre : genreNames)
			filmService.addGenre(film.getId(), genre, genre.equals(primaryGenre));
		return film;
	}

	@Transactional
	public UserAccount createUser(String caller, String username, String fullName, String email, UserRole role) {
		return accessControlService.createUser(caller, username, fullName, email, role);
	}

	@Transactional
	public void updateLogin(String username, boolean success, String ipAddress) {
		accessControlService.recordLogin(username, success, ipAddress);
	}

	private static ShootingLocation newLocation(String name, String city, String country, BigDecimal costPerDay) {
		if (name == null || name.isBlank())
			throw new ValidationException("Location name is required");
		ShootingLocation location = new ShootingLocation();
		location.setName(name);
		location.setCity(city);
		location.setCountry(country);
		location.setCostPerDay(costPerDay);
		return location;
	}

	static Set<String> splitGenres(String genres) {
		if (genres == null)
			return new LinkedHashSet<>();
		return Arrays.stream(genres.split(","))
				.map(String::trim)
				.filter(genre -> !genre.isEmpty())
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}
}
