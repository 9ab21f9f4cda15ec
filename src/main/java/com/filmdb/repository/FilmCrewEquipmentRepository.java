package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.FilmCrewEquipment;

/**
 * Repository für die Equipment-Zuordnungen der Crew eines Films.
 */
@ApplicationScoped
public class FilmCrewEquipmentRepository extends BaseRepository<FilmCrewEquipment, Integer> {

	public FilmCrewEquipmentRepository() {
		super(FilmCrewEquipment.class);
	}

	public List<FilmCrewEquipment> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public boolean existsByFilmCrewAndEquipment(Integer filmId, Integer crewId, Integer equipmentId) {
		return em.createQuery("select count(e) from FilmCrewEquipment e where e.filmId = :filmId"
				+ " and e.crewId = :crewId and e.equipmentId = :equipmentId", Long.class)
				.setParameter("filmId", filmId)
				.setParameter("crewId", crewId)
				.setParameter("equipmentId", equipmentId)
				.getSingleResult() > 0;
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteByCrewId(Integer crewId) {
		return deleteBy("crewId", crewId);
	}

	public int deleteByEquipmentId(Integer equipmentId) {
		return deleteBy("equipmentId", equipmentId);
	}
}
