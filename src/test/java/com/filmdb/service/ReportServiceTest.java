package com.filmdb.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.filmdb.entity.Actor;
import com.filmdb.entity.ActorAward;
import com.filmdb.entity.Director;
import com.filmdb.entity.Distributes;
import com.filmdb.entity.Distributor;
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

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

	@Mock
	FilmRepository filmRepository;

	@Mock
	DirectorRepository directorRepository;

	@Mock
	ActorRepository actorRepository;

	@Mock
	ProducerRepository producerRepository;

	@Mock
	CrewRepository crewRepository;

	@Mock
	DistributorRepository distributorRepository;

	@Mock
	RoleRepository roleRepository;

	@Mock
	SceneRepository sceneRepository;

	@Mock
	WorksOnRepository worksOnRepository;

	@Mock
	ShotAtRepository shotAtRepository;

	@Mock
	ProducedByRepository producedByRepository;

	@Mock
	SceneFilmingRepository sceneFilmingRepository;

	@Mock
	DistributesRepository distributesRepository;

	@Mock
	EquipmentRepository equipmentRepository;

	@Mock
	FilmCrewEquipmentRepository crewEquipmentRepository;

	@Mock
	ActorAwardRepository actorAwardRepository;

	@InjectMocks
	ReportService reports;

	@Test
	@DisplayName("crew payroll counts both end dates as working days and sums the filmed minutes")
	void crewPayroll_shouldCountInclusiveDaysAndMinutes() {
		// Arrange
		WorksOn assignment = new WorksOn();
		assignment.setCrewId(7);
		assignment.setFilmId(1);
		assignment.setStartDate(LocalDate.of(2025, 3, 1));
		assignment.setEndDate(LocalDate.of(2025, 3, 10));
		when(filmRepository.existsById(1)).thenReturn(true);
		when(worksOnRepository.findByFilmId(1)).thenReturn(List.of(assignment));
		when(crewRepository.findById(7)).thenReturn(Optional.of(Fixtures.crew(7, "Kim", "Camera")));
		when(sceneFilmingRepository.findByFilmIdAndCrewId(1, 7)).thenReturn(List.of(filming(90), filming(45)));

		// Act
		List<CrewPayrollEntryDTO> payroll = reports.crewPayroll(1);

		// Assert
		assertThat(payroll).singleElement().satisfies(entry -> {
			assertThat(entry.workingDays()).isEqualTo(10);
			assertThat(entry.shoots()).isEqualTo(2);
			assertThat(entry.totalMinutes()).isEqualTo(135);
			assertThat(entry.department()).isEqualTo("Camera");
		});
	}

	@Test
	@DisplayName("producer summary aggregates count, total, average, maximum and minimum")
	void producerInvestment_shouldAggregateShares() {
		Producer producer = new Producer();
		producer.setId(3);
		producer.setName("Ada Reel");
		when(producerRepository.findById(3)).thenReturn(Optional.of(producer));
		when(producedByRepository.findByProducerId(3)).thenReturn(List.of(share(1, 100_000), share(2, 300_000)));

		ProducerInvestmentSummaryDTO summary = reports.producerInvestment(3);

		assertThat(summary.filmCount()).isEqualTo(2);
		assertThat(summary.totalInvestment()).isEqualByComparingTo("400000");
		assertThat(summary.averageInvestment()).isEqualByComparingTo("200000");
		assertThat(summary.maxInvestment()).isEqualByComparingTo("300000");
		assertThat(summary.minInvestment()).isEqualByComparingTo("100000");
	}

	@Test
	@DisplayName("box office analysis reports profit, roi, director and cast size")
	void boxOfficeAnalysis_shouldEnrichFilms() {
		Film film = Fixtures.film(1, "Nova", 500_000);
		film.setBoxOfficeCollection(BigDecimal.valueOf(750_000));
		film.setDirectorId(5);
		Director director = new Director();
		director.setName("R. Vega");
		when(filmRepository.findWithBoxOffice()).thenReturn(List.of(film));
		when(directorRepository.findById(5)).thenReturn(Optional.of(director));
		when(roleRepository.countDistinctActorsByFilmId(1)).thenReturn(4L);

		List<BoxOfficeEntryDTO> analysis = reports.boxOfficeAnalysis();

		assertThat(analysis).singleElement().satisfies(entry -> {
			assertThat(entry.profit()).isEqualByComparingTo("250000");
			assertThat(entry.roi()).isEqualByComparingTo("50.00");
			assertThat(entry.directorName()).isEqualTo("R. Vega");
			assertThat(entry.castSize()).isEqualTo(4);
		});
	}

	@Test
	@DisplayName("reports for an unknown film fail with RecordNotFoundException")
	void productionSummary_shouldFailForUnknownFilm() {
		when(filmRepository.findById(404)).thenReturn(Optional.empty());

		assertThatThrownBy(() -> reports.productionSummary(404)).isInstanceOf(RecordNotFoundException.class);
	}

	@Test
	@DisplayName("production summary carries the director name and the distinct counts")
	void productionSummary_shouldReportDistinctCounts() {
		Film film = Fixtures.film(1, "Nova", 500_000);
		film.setDirectorId(5);
		Director director = new Director();
		director.setName("R. Vega");
		when(filmRepository.findById(1)).thenReturn(Optional.of(film));
		when(directorRepository.findById(5)).thenReturn(Optional.of(director));
		when(roleRepository.countDistinctActorsByFilmId(1)).thenReturn(3L);
		when(sceneRepository.countByFilmId(1)).thenReturn(12L);
		when(worksOnRepository.countDistinctCrewByFilmId(1)).thenReturn(8L);
		when(shotAtRepository.countDistinctLocationsByFilmId(1)).thenReturn(2L);

		FilmProductionSummaryDTO summary = reports.productionSummary(1);

		assertThat(summary.directorName()).isEqualTo("R. Vega");
		assertThat(summary.actorCount()).isEqualTo(3);
		assertThat(summary.sceneCount()).isEqualTo(12);
		assertThat(summary.crewCount()).isEqualTo(8);
		assertThat(summary.locationCount()).isEqualTo(2);
	}

	// ==================== Filmografien ====================

	@Test
	@DisplayName("actor filmography lists the newest release first and undated films last")
	void actorFilmography_shouldOrderNewestFirstAndUndatedLast() {
		// Arrange
		when(actorRepository.existsById(2)).thenReturn(true);
		when(roleRepository.findByActorId(2)).thenReturn(List.of(role(1, "Ines"), role(2, "Mara"), role(3, "Juno")));
		when(filmRepository.findById(1)).thenReturn(Optional.of(released(1, "Old", LocalDate.of(2019, 4, 1))));
		when(filmRepository.findById(2)).thenReturn(Optional.of(released(2, "Unreleased", null)));
		when(filmRepository.findById(3)).thenReturn(Optional.of(released(3, "New", LocalDate.of(2023, 9, 15))));

		// Act
		List<ActorFilmographyEntryDTO> filmography = reports.actorFilmography(2);

		// Assert
		assertThat(filmography).extracting(ActorFilmographyEntryDTO::title).containsExactly("New", "Old", "Unreleased");
		assertThat(filmography).extracting(ActorFilmographyEntryDTO::characterName)
				.containsExactly("Juno", "Ines", "Mara");
	}

	@Test
	@DisplayName("director filmography computes profit and roi, a missing collection counts as zero")
	void directorFilmography_shouldComputeProfitAndRoi() {
		Film hit = released(1, "Hit", LocalDate.of(2022, 1, 1));
		hit.setBudget(BigDecimal.valueOf(400_000));
		hit.setBoxOfficeCollection(BigDecimal.valueOf(1_000_000));
		Film pending = released(2, "Pending", LocalDate.of(2024, 1, 1));
		pending.setBudget(BigDecimal.valueOf(200_000));
		when(directorRepository.existsById(5)).thenReturn(true);
		when(filmRepository.findByDirectorId(5)).thenReturn(List.of(hit, pending));

		List<DirectorFilmographyEntryDTO> filmography = reports.directorFilmography(5);

		assertThat(filmography).extracting(DirectorFilmographyEntryDTO::title).containsExactly("Pending", "Hit");
		assertThat(filmography.get(1).profit()).isEqualByComparingTo("600000");
		assertThat(filmography.get(1).roi()).isEqualByComparingTo("150.00");
		assertThat(filmography.get(0).profit()).isEqualByComparingTo("-200000");
		assertThat(filmography.get(0).roi()).isEqualByComparingTo("-100.00");
	}

	// ==================== Verleiher ====================

	@Test
	@DisplayName("distributors are ordered by total fees, highest first")
	void distributorPerformance_shouldOrderByTotalFees() {
		when(distributorRepository.listAll()).thenReturn(List.of(distributor(1, "Small"), distributor(2, "Large")));
		when(distributesRepository.findByDistributorId(1)).thenReturn(List.of(deal(1, 3, 50_000)));
		when(distributesRepository.findByDistributorId(2))
				.thenReturn(List.of(deal(2, 4, 70_000), deal(2, 5, 30_000)));
		when(filmRepository.findById(3)).thenReturn(Optional.of(collected(3, 200_000L)));
		when(filmRepository.findById(4)).thenReturn(Optional.of(collected(4, 300_000L)));
		when(filmRepository.findById(5)).thenReturn(Optional.of(collected(5, 500_000L)));

		List<DistributorPerformanceDTO> performance = reports.distributorPerformance();

		assertThat(performance).extracting(DistributorPerformanceDTO::name).containsExactly("Large", "Small");
		assertThat(performance.get(0).totalFees()).isEqualByComparingTo("100000");
		assertThat(performance.get(0).filmsDistributed()).isEqualTo(2);
		assertThat(performance.get(0).averageBoxOffice()).isEqualByComparingTo("400000");
	}

	@Test
	@DisplayName("films without a box office collection do not lower the distributor average")
	void distributorPerformance_shouldAverageOnlyKnownCollections() {
		when(distributorRepository.listAll()).thenReturn(List.of(distributor(1, "Nordlicht")));
		when(distributesRepository.findByDistributorId(1)).thenReturn(List.of(deal(1, 3, 10_000), deal(1, 4, 10_000)));
		when(filmRepository.findById(3)).thenReturn(Optional.of(collected(3, 1_000_000L)));
		when(filmRepository.findById(4)).thenReturn(Optional.of(collected(4, null)));

		DistributorPerformanceDTO performance = reports.distributorPerformance().get(0);

		assertThat(performance.filmsDistributed()).isEqualTo(2);
		assertThat(performance.averageBoxOffice()).isEqualByComparingTo("1000000");
	}

	@Test
	@DisplayName("a distributor whose films have no collection averages zero")
	void distributorPerformance_shouldReportZeroWithoutCollections() {
		when(distributorRepository.listAll()).thenReturn(List.of(distributor(1, "Nordlicht")));
		when(distributesRepository.findByDistributorId(1)).thenReturn(List.of(deal(1, 4, 10_000)));
		when(filmRepository.findById(4)).thenReturn(Optional.of(collected(4, null)));

		assertThat(reports.distributorPerformance().get(0).averageBoxOffice()).isEqualByComparingTo("0");
	}

	// ==================== Equipment und Auszeichnungen ====================

	@Test
	@DisplayName("equipment usage lists every crew assignment with the film's shoot counts for that equipment")
	void equipmentUsageReport_shouldCombineAssignmentsAndFilmings() {
		// Arrange
		when(filmRepository.existsById(1)).thenReturn(true);
		SceneFilming byKim = filming(30);
		byKim.setEquipmentId(9);
		SceneFilming byLee = filming(20);
		byLee.setCrewId(8);
		byLee.setEquipmentId(9);
		SceneFilming withoutEquipment = filming(15);
		when(sceneFilmingRepository.findByFilmId(1)).thenReturn(List.of(byKim, byLee, withoutEquipment));
		when(crewEquipmentRepository.findByFilmId(1)).thenReturn(List.of(assignment(8, 9, 3), assignment(7, 9, 5)));
		when(equipmentRepository.findById(9)).thenReturn(Optional.of(Fixtures.equipment(9, "Arri Alexa")));

		// Act
		List<EquipmentUsageReportEntryDTO> report = reports.equipmentUsageReport(1);

		// Assert
		assertThat(report).extracting(EquipmentUsageReportEntryDTO::crewId).containsExactly(7, 8);
		assertThat(report.get(0).daysUsed()).isEqualTo(5);
		assertThat(report.get(0).name()).isEqualTo("Arri Alexa");
		assertThat(report).allSatisfy(entry -> {
			assertThat(entry.timesUsed()).isEqualTo(2);
			assertThat(entry.crewMembersUsed()).isEqualTo(2);
		});
	}

	@Test
	@DisplayName("equipment usage of an unknown film fails with RecordNotFoundException")
	void equipmentUsageReport_shouldFailForUnknownFilm() {
		when(filmRepository.existsById(404)).thenReturn(false);

		assertThatThrownBy(() -> reports.equipmentUsageReport(404)).isInstanceOf(RecordNotFoundException.class);
	}

	@Test
	@DisplayName("award history lists the newest year first and counts all awards")
	void actorAwardHistory_shouldOrderByYearDescending() {
		Actor actor = Fixtures.actor(2, LocalDate.of(1990, 5, 1));
		actor.setNationality("Swedish");
		when(actorRepository.findById(2)).thenReturn(Optional.of(actor));
		when(actorAwardRepository.findByRecipientId(2))
				.thenReturn(List.of(award("Silver Frame", 2019), award("Nordic Screen", 2022), award("Golden Lens", 2022)));

		ActorAwardHistoryDTO history = reports.actorAwardHistory(2);

		assertThat(history.totalAwards()).isEqualTo(3);
		assertThat(history.nationality()).isEqualTo("Swedish");
		assertThat(history.awards()).containsExactly(
				new ActorAwardHistoryDTO.AwardEntry("Golden Lens", 2022),
				new ActorAwardHistoryDTO.AwardEntry("Nordic Screen", 2022),
				new ActorAwardHistoryDTO.AwardEntry("Silver Frame", 2019));
	}

	@Test
	@DisplayName("an actor without awards gets an empty history")
	void actorAwardHistory_shouldBeEmptyWithoutAwards() {
		when(actorRepository.findById(2)).thenReturn(Optional.of(Fixtures.actor(2, LocalDate.of(1990, 5, 1))));
		when(actorAwardRepository.findByRecipientId(2)).thenReturn(List.of());

		ActorAwardHistoryDTO history = reports.actorAwardHistory(2);

		assertThat(history.totalAwards()).isZero();
		assertThat(history.awards()).isEmpty();
	}

	private static SceneFilming filming(int minutes) {
		SceneFilming filming = new SceneFilming();
		filming.setFilmId(1);
		filming.setCrewId(7);
		filming.setDurationMinutes(minutes);
		return filming;
	}

	private static ProducedBy share(Integer filmId, long investment) {
		ProducedBy share = new ProducedBy();
		share.setFilmId(filmId);
		share.setProducerId(3);
		share.setInvestment(BigDecimal.valueOf(investment));
		return share;
	}

	private static Role role(Integer filmId, String characterName) {
		Role role = new Role();
		role.setActorId(2);
		role.setFilmId(filmId);
		role.setCharacterName(characterName);
		return role;
	}

	private static Film released(Integer id, String title, LocalDate releaseDate) {
		Film film = Fixtures.film(id, title, 100_000);
		film.setReleaseDate(releaseDate);
		return film;
	}

	private static Film collected(Integer id, Long boxOffice) {
		Film film = Fixtures.film(id, "Film " + id, 100_000);
		film.setBoxOfficeCollection(boxOffice == null ? null : BigDecimal.valueOf(boxOffice));
		return film;
	}

	private static Distributor distributor(Integer id, String name) {
		Distributor distributor = new Distributor();
		distributor.setId(id);
		distributor.setName(name);
		return distributor;
	}

	private static Distributes deal(Integer distributorId, Integer filmId, long fee) {
		Distributes deal = new Distributes();
		deal.setDistributorId(distributorId);
		deal.setFilmId(filmId);
		deal.setDistributionFee(BigDecimal.valueOf(fee));
		return deal;
	}

	private static FilmCrewEquipment assignment(Integer crewId, Integer equipmentId, int daysUsed) {
		FilmCrewEquipment assignment = new FilmCrewEquipment();
		assignment.setFilmId(1);
		assignment.setCrewId(crewId);
		assignment.setEquipmentId(equipmentId);
		assignment.setDaysUsed(daysUsed);
		return assignment;
	}

	private static ActorAward award(String name, int year) {
		ActorAward award = new ActorAward();
		award.setActorId(2);
		award.setAwardName(name);
		award.setAwardYear(year);
		return award;
	}
}
