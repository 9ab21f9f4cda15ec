package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Studio;

/**
 * Repository für Studios.
 */
@ApplicationScoped
public class StudioRepository extends BaseRepository<Studio, Integer> {

	public StudioRepository() {
		super(Studio.class);
	}
}
