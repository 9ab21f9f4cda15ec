package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.WorksOn;

/**
 * Repository für Arbeitszuordnungen der Crew.
 */
@ApplicationScoped
public class WorksOnRepository extends BaseRepository<WorksOn, Integer> {

	public WorksOnRepository() {
		super(WorksOn.class);
	}

	public List<WorksOn> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public boolean existsByCrewAndFilm(Integer crewId, Integer filmId) {
		return existsByPair("crewId", crewId, "filmId", filmId);
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteByCrewId(Integer crewId) {
		return deleteBy("crewId", crewId);
	}

	public long countDistinctCrewByFilmId(Integer filmId) {
		return em.createQuery("select count(distinct w.crewId) from WorksOn w where w.filmId = :filmId", Long.class)
				.setParameter("filmId", filmId)
				.getSingleResult();
	}
}
