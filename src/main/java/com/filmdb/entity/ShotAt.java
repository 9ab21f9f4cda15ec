package com.filmdb.entity;

import java.math.BigDecimal;
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
 * Buchung eines Drehorts für einen Film über einen Datumsbereich.
 */
@Entity
@Table(name = "shot_at", uniqueConstraints = @UniqueConstraint(name = "uq_shot_at", columnNames = { "film_id",
		"location_id" }))
@Getter
@Setter
public class ShotAt {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "location_id", nullable = false)
	private Integer locationId;

	@Column(name = "shooting_start")
	private LocalDate shootingStart;

	@Column(name = "shooting_end")
	private LocalDate shootingEnd;

	@Column(name = "total_cost", precision = 15, scale = 2)
	private BigDecimal totalCost = BigDecimal.ZERO;
}
