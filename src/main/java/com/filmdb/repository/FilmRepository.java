package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Film;

/**
 * Repository für Film-Entitäten.
 */
@ApplicationScoped
public class FilmRepository extends BaseRepository<Film, Integer> {

	public FilmRepository() {
		super(Film.class);
	}

	public List<Film> findByDirectorId(Integer directorId) {
		return listBy("directorId", directorId);
	}

	public long countByDirectorId(Integer directorId) {
		return countBy("directorId", directorId);
	}

	/**
	 * Filme mit Einspielergebnis, absteigend nach Einspielergebnis.
	 */
	public List<Film> findWithBoxOffice() {
		return em.createQuery("select f from Film f where f.boxOfficeCollection > 0 order by f.boxOfficeCollection desc",
				Film.class)
				.getResultList();
	}

	/**
	 * Entfernt die Regie-Referenz aller Filme eines gelöschten Regisseurs.
	 */
	public int clearDirector(Integer directorId) {
		return nullify("directorId", directorId);
	}
}
