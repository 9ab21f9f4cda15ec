package com.filmdb.repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Role;

/**
 * Repository für Besetzungen (Schauspieler x Film x Charakter).
 */
@ApplicationScoped
public class RoleRepository extends BaseRepository<Role, Integer> {

	public RoleRepository() {
		super(Role.class);
	}

	public List<Role> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public List<Role> findByActorId(Integer actorId) {
		return listBy("actorId", actorId);
	}

	/**
	 * Prüft den Eindeutigkeitsschlüssel (actor_id, film_id, character_name).
	 */
	public boolean existsByActorFilmAndCharacter(Integer actorId, Integer filmId, String characterName) {
		return em.createQuery("select count(r) from Role r where r.actorId = :actorId and r.filmId = :filmId"
				+ " and r.characterName = :characterName", Long.class)
				.setParameter("actorId", actorId)
				.setParameter("filmId", filmId)
				.setParameter("characterName", characterName)
				.getSingleResult() > 0;
	}

	/**
	 * Durchschnittsgage der Besetzung eines Films, 0 ohne Besetzung.
	 */
	public BigDecimal averageSalaryByFilmId(Integer filmId) {
		Double avg = em.createQuery("select avg(r.salary) from Role r where r.filmId = :filmId", Double.class)
				.setParameter("filmId", filmId)
				.getSingleResult();
		if (avg == null)
			return BigDecimal.ZERO.setScale(2);
		return BigDecimal.valueOf(avg).setScale(2, RoundingMode.HALF_UP);
	}

	public long sumScreenTime(Integer actorId, Integer filmId) {
		Long sum = em.createQuery("select sum(r.screenTime) from Role r where r.actorId = :actorId and r.filmId = :filmId",
				Long.class)
				.setParameter("actorId", actorId)
				.setParameter("filmId", filmId)
				.getSingleResult();
		return sum == null ? 0L : sum;
	}

	public long countDistinctActorsByFilmId(Integer filmId) {
		return em.createQuery("select count(distinct r.actorId) from Role r where r.filmId = :filmId", Long.class)
				.setParameter("filmId", filmId)
				.getSingleResult();
	}
}
