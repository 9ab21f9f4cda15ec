package com.filmdb.repository;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.FilmCertificate;

/**
 * Repository für Altersfreigaben; höchstens eine je Film.
 */
@ApplicationScoped
public class FilmCertificateRepository extends BaseRepository<FilmCertificate, Integer> {

	public FilmCertificateRepository() {
		super(FilmCertificate.class);
	}

	public Optional<FilmCertificate> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId).stream().findFirst();
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}
}
