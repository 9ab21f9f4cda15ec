package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Producer;

/**
 * Repository für Produzenten.
 */
@ApplicationScoped
public class ProducerRepository extends BaseRepository<Producer, Integer> {

	public ProducerRepository() {
		super(Producer.class);
	}
}
