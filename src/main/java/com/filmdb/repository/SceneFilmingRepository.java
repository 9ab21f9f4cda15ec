package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.SceneFilming;

/**
 * Repository für Dreheinsätze (Szene x Crew x Equipment).
 */
@ApplicationScoped
public class SceneFilmingRepository extends BaseRepository<SceneFilming, Integer> {

	public SceneFilmingRepository() {
		super(SceneFilming.class);
	}

	public List<SceneFilming> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public List<SceneFilming> findByFilmIdAndCrewId(Integer filmId, Integer crewId) {
		return em.createQuery("select s from SceneFilming s where s.filmId = :filmId and s.crewId = :crewId order by s.id",
				SceneFilming.class)
				.setParameter("filmId", filmId)
				.setParameter("crewId", crewId)
				.getResultList();
	}

	/**
	 * Summe der Drehminuten aller Einsätze eines Films, 0 ohne Einsätze.
	 */
	public long sumDurationByFilmId(Integer filmId) {
		Long sum = em.createQuery("select sum(s.durationMinutes) from SceneFilming s where s.filmId = :filmId", Long.class)
				.setParameter("filmId", filmId)
				.getSingleResult();
		return sum == null ? 0L : sum;
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteBySceneId(Integer sceneId) {
		return deleteBy("sceneId", sceneId);
	}

	public int deleteByCrewId(Integer crewId) {
		return deleteBy("crewId", crewId);
	}

	public int clearEquipment(Integer equipmentId) {
		return nullify("equipmentId", equipmentId);
	}
}
