package com.filmdb.entity;

import java.math.BigDecimal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.Getter;
import lombok.Setter;

/**
 * Drehort mit Tagessatz.
 */
@Entity
@Table(name = "shooting_location")
@Getter
@Setter
public class ShootingLocation {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 120)
	private String name;

	@Column(length = 80)
	private String city;

	@Column(length = 80)
	private String state;

	@Column(length = 80)
	private String country;

	@Column(name = "cost_per_day", precision = 12, scale = 2)
	private BigDecimal costPerDay = BigDecimal.ZERO;

	@Column(length = 80)
	private String area;

	@Column(columnDefinition = "TEXT")
	private String amenities;
}
