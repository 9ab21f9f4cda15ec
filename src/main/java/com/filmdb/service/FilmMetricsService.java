package com.filmdb.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.filmdb.entity.Availability;
import com.filmdb.entity.Equipment;
import com.filmdb.entity.Film;
import com.filmdb.entity.dto.FilmMetricsDTO;
import com.filmdb.repository.ActorRepository;
import com.filmdb.repository.EquipmentRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.ProducedByRepository;
import com.filmdb.repository.RoleRepository;
import com.filmdb.repository.SceneFilmingRepository;
import com.filmdb.repository.SceneRepository;

/**
 * Lesende Kennzahlen über den aktuellen Datenbestand.
 * <p>
 * Fehlt der referenzierte Datensatz, liefern alle Methoden einen festen Standardwert statt eines Fehlers.
 */
@ApplicationScoped
public class FilmMetricsService {

	static final String UNKNOWN_AVAILABILITY = "Unknown";

	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
	private static final BigDecimal ZERO_PERCENT = BigDecimal.ZERO.setScale(2);

	@Inject
	Clock clock;

	@Inject
	FilmRepository filmRepository;

	@Inject
	ActorRepository actorRepository;

	@Inject
	ProducedByRepository producedByRepository;

	@Inject
	SceneRepository sceneRepository;

	@Inject
	SceneFilmingRepository sceneFilmingRepository;

	@Inject
	RoleRepository roleRepository;

	@Inject
	EquipmentRepository equipmentRepository;

	/**
	 * Einspielergebnis minus Budget; fehlende Beträge zählen als 0.
	 */
	public BigDecimal profit(Integer filmId) {
		return filmRepository.findById(filmId).map(FilmMetricsService::profitOf).orElse(BigDecimal.ZERO);
	}

	/**
	 * Gewinn in Prozent des Budgets, zwei Nachkommastellen. Bei Budget 0 oder unbekanntem Film 0.
	 */
	public BigDecimal roi(Integer filmId) {
		return filmRepository.findById(filmId).map(FilmMetricsService::roiOf).orElse(ZERO_PERCENT);
	}

	/**
	 * Alter als Differenz der Kalenderjahre.
	 */
	public int age(Integer actorId) {
		int currentYear = LocalDate.now(clock).getYear();
		return actorRepository.findById(actorId)
				.filter(actor -> actor.getDateOfBirth() != null)
				.map(actor -> currentYear - actor.getDateOfBirth().getYear())
				.orElse(0);
	}

	public long filmCount(Integer directorId) {
		return filmRepository.countByDirectorId(directorId);
	}

	public BigDecimal totalInvestment(Integer producerId) {
		return producedByRepository.sumInvestmentByProducerId(producerId);
	}

	/**
	 * Summe der protokollierten Drehminuten aller Crew-Einsätze eines Films.
	 */
	public long totalCrewMinutes(Integer filmId) {
		return sceneFilmingRepository.sumDurationByFilmId(filmId);
	}

	public long sceneCount(Integer filmId) {
		return sceneRepository.countByFilmId(filmId);
	}

	public BigDecimal averageCastSalary(Integer filmId) {
		return roleRepository.averageSalaryByFilmId(filmId);
	}

	public long actorScreenTime(Integer actorId, Integer filmId) {
		return roleRepository.sumScreenTime(actorId, filmId);
	}

	public String equipmentAvailability(Integer equipmentId) {
		return equipmentRepository.findById(equipmentId)
				.map(Equipment::getAvailability)
				.map(Availability::name)
				.orElse(UNKNOWN_AVAILABILITY);
	}

	public FilmMetricsDTO metricsOf(Integer filmId) {
		return new FilmMetricsDTO(
				filmId,
				profit(filmId),
				roi(filmId),
				totalCrewMinutes(filmId),
				sceneCount(filmId),
				averageCastSalary(filmId));
	}

	static BigDecimal profitOf(Film film) {
		return nullToZero(film.getBoxOfficeCollection()).subtract(nullToZero(film.getBudget()));
	}

	static BigDecimal roiOf(Film film) {
		BigDecimal budget = nullToZero(film.getBudget());
		if (budget.signum() <= 0)
			return ZERO_PERCENT;
		return profitOf(film).multiply(HUNDRED).divide(budget, 2, RoundingMode.HALF_UP);
	}

	private static BigDecimal nullToZero(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}
}
