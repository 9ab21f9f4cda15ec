package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.CrewAward;

/**
 * Repository für Auszeichnungen von Crew-Mitgliedern.
 */
@ApplicationScoped
public class CrewAwardRepository extends AwardRepository<CrewAward> {

	public CrewAwardRepository() {
		super(CrewAward.class, "crewId");
	}
}
