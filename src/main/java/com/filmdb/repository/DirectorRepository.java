package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Director;

/**
 * Repository für Regisseure.
 */
@ApplicationScoped
public class DirectorRepository extends BaseRepository<Director, Integer> {

	public DirectorRepository() {
		super(Director.class);
	}
}
