package com.filmdb.repository;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.Equipment;

/**
 * Repository für Equipment.
 */
@ApplicationScoped
public class EquipmentRepository extends BaseRepository<Equipment, Integer> {

	public EquipmentRepository() {
		super(Equipment.class);
	}
}
