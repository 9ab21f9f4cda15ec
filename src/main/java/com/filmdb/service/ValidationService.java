package com.filmdb.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.filmdb.entity.Actor;
import com.filmdb.entity.Crew;
import com.filmdb.entity.Distributor;
import com.filmdb.entity.Equipment;
import com.filmdb.entity.Film;
import com.filmdb.entity.Role;
import com.filmdb.entity.ShootingLocation;
import com.filmdb.entity.ShotAt;
import com.filmdb.exception.ValidationException;

/**
 * Prüfregeln, die vor dem Schreiben eines einzelnen Datensatzes ausgeführt werden.
 * <p>
 * Jede Regel betrachtet ausschließlich den zu schreibenden Datensatz (bei Updates zusätzlich dessen
 * Vorzustand). Referenzen auf andere Datensätze werden nicht hier, sondern beim Schreiben über die
 * Fremdschlüsselprüfung der Services abgesichert.
 */
@ApplicationScoped
public class ValidationService {

	private static final Logger LOG = Logger.getLogger(ValidationService.class);

	private static final BigDecimal MAX_RATING = BigDecimal.TEN;
	private static final BigDecimal MAX_MARKET_SHARE = BigDecimal.valueOf(100);

	@Inject
	Clock clock;

	@ConfigProperty(name = "filmdb.validation.min-film-budget", defaultValue = "100000")
	BigDecimal minFilmBudget;

	@ConfigProperty(name = "filmdb.validation.min-actor-age", defaultValue = "18")
	int minActorAge;

	/**
	 * Schauspieler müssen beim Anlegen mindestens 18 Jahre alt sein (Jahresdifferenz, nicht taggenau).
	 */
	public void validateActorInsert(Actor actor) {
		if (actor.getDateOfBirth() == null)
			reject("Actor", "Actor date of birth is required");
		int age = LocalDate.now(clock).getYear() - actor.getDateOfBirth().getYear();
		if (age < minActorAge)
			reject("Actor", "Actor must be at least " + minActorAge + " years old");
	}

	public void validateFilmInsert(Film film) {
		validateFilm(film);
	}

	/**
	 * Prüft den vorgeschlagenen Zustand eines Films gegen dieselben Regeln wie beim Anlegen.
	 */
	public void validateFilmUpdate(Film prior, Film proposed) {
		try {
			validateFilm(proposed);
		} catch (ValidationException e) {
			LOG.debugf("Keeping film %s at budget %s", prior.getId(), prior.getBudget());
			throw e;
		}
	}

	public void validateEquipment(Equipment equipment) {
		if (isNegative(equipment.getCost()))
			reject("Equipment", "Equipment cost cannot be negative");
	}

	public void validateShootingLocation(ShootingLocation location) {
		if (isNegative(location.getCostPerDay()))
			reject("ShootingLocation", "Location cost per day cannot be negative");
	}

	public void validateCrew(Crew crew) {
		if (crew.getExperienceYears() != null && crew.getExperienceYears() < 0)
			reject("Crew", "Experience years cannot be negative");
		if (crew.getId() != null && Objects.equals(crew.getId(), crew.getSupervisorId()))
			reject("Crew", "Crew member cannot supervise themselves");
	}

	public void validateRole(Role role) {
		if (isNegative(role.getSalary()))
			reject("Role", "Role salary cannot be negative");
	}

	public void validateShotAt(ShotAt shotAt) {
		if (shotAt.getShootingStart() == null || shotAt.getShootingEnd() == null)
			reject("ShotAt", "Shooting start and end dates are required");
		if (shotAt.getShootingEnd().isBefore(shotAt.getShootingStart()))
			reject("ShotAt", "Shooting end date cannot be before start date");
	}

	public void validateDistributor(Distributor distributor) {
		BigDecimal share = distributor.getMarketShare();
		if (share != null && (share.signum() < 0 || share.compareTo(MAX_MARKET_SHARE) > 0))
			reject("Distributor", "Market share must be between 0 and 100");
	}

	private void validateFilm(Film film) {
		BigDecimal budget = film.getBudget() == null ? BigDecimal.ZERO : film.getBudget();
		if (budget.compareTo(minFilmBudget) < 0)
			reject("Film", String.format(Locale.US, "Minimum film budget is $%,.0f", minFilmBudget));
		if (film.getDuration() != null && film.getDuration() <= 0)
			reject("Film", "Film duration must be positive");
		BigDecimal rating = film.getRating();
		if (rating != null && (rating.signum() < 0 || rating.compareTo(MAX_RATING) > 0))
			reject("Film", "Film rating must be between 0 and 10");
	}

	private static boolean isNegative(BigDecimal value) {
		return value != null && value.signum() < 0;
	}

	private static void reject(String entity, String reason) {
		LOG.warnf("Rejected %s write: %s", entity, reason);
		throw new ValidationException(reason);
	}
}
