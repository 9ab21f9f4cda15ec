package com.filmdb.repository;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.FilmGenre;

/**
 * Repository für die Genre-Zuordnungen eines Films.
 */
@ApplicationScoped
public class FilmGenreRepository extends BaseRepository<FilmGenre, Integer> {

	public FilmGenreRepository() {
		super(FilmGenre.class);
	}

	public List<FilmGenre> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public Optional<FilmGenre> findByFilmIdAndGenre(Integer filmId, String genre) {
		return em.createQuery("select g from FilmGenre g where g.filmId = :filmId and g.genre = :genre",
				FilmGenre.class)
				.setParameter("filmId", filmId)
				.setParameter("genre", genre)
				.getResultStream()
				.findFirst();
	}

	public boolean existsByFilmIdAndGenre(Integer filmId, String genre) {
		return em.createQuery("select count(g) from FilmGenre g where g.filmId = :filmId and g.genre = :genre",
				Long.class)
				.setParameter("filmId", filmId)
				.setParameter("genre", genre)
				.getSingleResult() > 0;
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}
}
