package com.filmdb.repository;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.ShootingLocation;

/**
 * Repository für Drehorte.
 */
@ApplicationScoped
public class ShootingLocationRepository extends BaseRepository<ShootingLocation, Integer> {

	public ShootingLocationRepository() {
		super(ShootingLocation.class);
	}

	/**
	 * Sucht einen Drehort anhand von Name und Stadt. Ohne Stadt passen nur Drehorte ohne Stadt.
	 */
	public Optional<ShootingLocation> findByNameAndCity(String name, String city) {
		if (city == null)
			return em.createQuery("select l from ShootingLocation l where l.name = :name and l.city is null order by l.id",
					ShootingLocation.class)
					.setParameter("name", name)
					.getResultStream()
					.findFirst();
		return em.createQuery("select l from ShootingLocation l where l.name = :name and l.city = :city order by l.id",
				ShootingLocation.class)
				.setParameter("name", name)
				.setParameter("city", city)
				.getResultStream()
				.findFirst();
	}
}
