package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.DirectorAward;

/**
 * Repository für Auszeichnungen von Regisseuren.
 */
@ApplicationScoped
public class DirectorAwardRepository extends AwardRepository<DirectorAward> {

	public DirectorAwardRepository() {
		super(DirectorAward.class, "directorId");
	}
}
