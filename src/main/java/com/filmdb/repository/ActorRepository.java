package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Actor;

/**
 * Repository für Schauspieler.
 */
@ApplicationScoped
public class ActorRepository extends BaseRepository<Actor, Integer> {

	public ActorRepository() {
		super(Actor.class);
	}
}
