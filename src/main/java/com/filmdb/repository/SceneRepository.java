package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Scene;

/**
 * Repository für Szenen eines Films.
 */
@ApplicationScoped
public class SceneRepository extends BaseRepository<Scene, Integer> {

	public SceneRepository() {
		super(Scene.class);
	}

	public List<Scene> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public long countByFilmId(Integer filmId) {
		return countBy("filmId", filmId);
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}
}
