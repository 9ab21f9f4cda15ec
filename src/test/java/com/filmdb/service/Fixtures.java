package com.filmdb.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import com.filmdb.entity.Actor;
import com.filmdb.entity.Crew;
import com.filmdb.entity.Equipment;
import com.filmdb.entity.Film;
import com.filmdb.entity.ProductionStatus;
import com.filmdb.entity.UserAccount;
import com.filmdb.entity.UserRole;

/**
 * Testdaten und fest eingestellte Uhr für die Service-Tests.
 */
final class Fixtures {

	static final Instant NOW = Instant.parse("2025-06-01T10:15:30Z");

	static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

	private Fixtures() {
	}

	static ValidationService validationService() {
		ValidationService validation = new ValidationService();
		validation.clock = CLOCK;
		validation.minFilmBudget = BigDecimal.valueOf(100_000);
		validation.minActorAge = 18;
		return validation;
	}

	static Film film(Integer id, String title, long budget) {
		Film film = new Film();
		film.setId(id);
		film.setTitle(title);
		film.setBudget(BigDecimal.valueOf(budget));
		film.setProductionStatus(ProductionStatus.PRE_PRODUCTION);
		return film;
	}

	static Actor actor(Integer id, LocalDate dateOfBirth) {
		Actor actor = new Actor();
		actor.setId(id);
		actor.setFirstName("Maya");
		actor.setLastName("Lind");
		actor.setDateOfBirth(dateOfBirth);
		return actor;
	}

	static Crew crew(Integer id, String name, String department) {
		Crew crew = new Crew();
		crew.setId(id);
		crew.setName(name);
		crew.setJobTitle("Gaffer");
		crew.setDepartment(department);
		return crew;
	}

	static Equipment equipment(Integer id, String name) {
		Equipment equipment = new Equipment();
		equipment.setId(id);
		equipment.setName(name);
		equipment.setCost(BigDecimal.valueOf(2_500));
		return equipment;
	}

	static UserAccount user(String username, UserRole role, boolean active) {
		UserAccount user = new UserAccount();
		user.setUsername(username);
		user.setFullName(username + " Example");
		user.setEmail(username + "@filmdb.test");
		user.setRole(role);
		user.setActive(active);
		return user;
	}
}
