package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Distributor;

/**
 * Repository für Verleiher.
 */
@ApplicationScoped
public class DistributorRepository extends BaseRepository<Distributor, Integer> {

	public DistributorRepository() {
		super(Distributor.class);
	}
}
