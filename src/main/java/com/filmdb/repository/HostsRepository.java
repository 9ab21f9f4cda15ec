package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Hosts;

/**
 * Repository für Studio-Anmietungen eines Films.
 */
@ApplicationScoped
public class HostsRepository extends BaseRepository<Hosts, Integer> {

	public HostsRepository() {
		super(Hosts.class);
	}

	public List<Hosts> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public boolean existsByStudioAndFilm(Integer studioId, Integer filmId) {
		return existsByPair("studioId", studioId, "filmId", filmId);
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteByStudioId(Integer studioId) {
		return deleteBy("studioId", studioId);
	}
}
