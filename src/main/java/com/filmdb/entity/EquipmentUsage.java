package com.filmdb.entity;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.Getter;
import lombok.Setter;

/**
 * Nutzungszeitraum eines Equipment-Stücks in einem Film.
 */
@Entity
@Table(name = "equipment_usage", uniqueConstraints = @UniqueConstraint(name = "uq_equipment_usage", columnNames = {
		"film_id", "equipment_id" }))
@Getter
@Setter
public class EquipmentUsage {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "equipment_id", nullable = false)
	private Integer equipmentId;

	@Column(name = "usage_start")
	private LocalDate usageStart;

	@Column(name = "usage_end")
	private LocalDate usageEnd;
}
