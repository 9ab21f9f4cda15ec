package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.ShotAt;

/**
 * Repository für Drehort-Buchungen eines Films.
 */
@ApplicationScoped
public class ShotAtRepository extends BaseRepository<ShotAt, Integer> {

	public ShotAtRepository() {
		super(ShotAt.class);
	}

	public List<ShotAt> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public boolean existsByFilmAndLocation(Integer filmId, Integer locationId) {
		return existsByPair("filmId", filmId, "locationId", locationId);
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteByLocationId(Integer locationId) {
		return deleteBy("locationId", locationId);
	}

	public long countDistinctLocationsByFilmId(Integer filmId) {
		return em.createQuery("select count(distinct s.locationId) from ShotAt s where s.filmId = :filmId", Long.class)
				.setParameter("filmId", filmId)
				.getSingleResult();
	}
}
