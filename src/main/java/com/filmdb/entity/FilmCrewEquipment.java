package com.filmdb.entity;

import java.math.BigDecimal;

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
 * Zuordnung eines Equipment-Stücks zu einem Crew-Mitglied innerhalb eines Films, mit Einsatztagen, Bewertung der
 * Effizienz und Wartungsbedarf.
 */
@Entity
@Table(name = "film_crew_equipment", uniqueConstraints = @UniqueConstraint(name = "uq_film_crew_equipment", columnNames = {
		"film_id", "crew_id", "equipment_id" }))
@Getter
@Setter
public class FilmCrewEquipment {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "crew_id", nullable = false)
	private Integer crewId;

	@Column(name = "equipment_id", nullable = false)
	private Integer equipmentId;

	@Column(name = "days_used")
	private Integer daysUsed = 0;

	// 0.0 bis 10.0
	@Column(name = "efficiency_rating", precision = 3, scale = 1)
	private BigDecimal efficiencyRating = BigDecimal.ZERO;

	@Column(name = "maintenance_required")
	private boolean maintenanceRequired;
}
