package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.ActorAward;

/**
 * Repository für Auszeichnungen von Schauspielern.
 */
@ApplicationScoped
public class ActorAwardRepository extends AwardRepository<ActorAward> {

	public ActorAwardRepository() {
		super(ActorAward.class, "actorId");
	}
}
