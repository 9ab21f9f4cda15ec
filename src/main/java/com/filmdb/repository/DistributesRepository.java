package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Distributes;

/**
 * Repository für Vertriebsverträge zwischen Verleihern und Filmen.
 */
@ApplicationScoped
public class DistributesRepository extends BaseRepository<Distributes, Integer> {

	public DistributesRepository() {
		super(Distributes.class);
	}

	public List<Distributes> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public List<Distributes> findByDistributorId(Integer distributorId) {
		return listBy("distributorId", distributorId);
	}

	public boolean existsByDistributorAndFilm(Integer distributorId, Integer filmId) {
		return existsByPair("distributorId", distributorId, "filmId", filmId);
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteByDistributorId(Integer distributorId) {
		return deleteBy("distributorId", distributorId);
	}
}
