package com.filmdb.repository;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.EquipmentUsage;

/**
 * Repository für die Nutzungszeiträume von Equipment je Film.
 */
@ApplicationScoped
public class EquipmentUsageRepository extends BaseRepository<EquipmentUsage, Integer> {

	public EquipmentUsageRepository() {
		super(EquipmentUsage.class);
	}

	public List<EquipmentUsage> findByFilmId(Integer filmId) {
		return listBy("filmId", filmId);
	}

	public boolean existsByFilmAndEquipment(Integer filmId, Integer equipmentId) {
		return existsByPair("filmId", filmId, "equipmentId", equipmentId);
	}

	public int deleteByFilmId(Integer filmId) {
		return deleteBy("filmId", filmId);
	}

	public int deleteByEquipmentId(Integer equipmentId) {
		return deleteBy("equipmentId", equipmentId);
	}
}
