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
 * Studiomiete für einen Film.
 */
@Entity
@Table(name = "hosts", uniqueConstraints = @UniqueConstraint(name = "uq_hosts", columnNames = { "studio_id",
		"film_id" }))
@Getter
@Setter
public class Hosts {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "studio_id", nullable = false)
	private Integer studioId;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "rental_cost", precision = 15, scale = 2)
	private BigDecimal rentalCost = BigDecimal.ZERO;

	@Column(name = "rental_start")
	private LocalDate rentalStart;

	@Column(name = "rental_end")
	private LocalDate rentalEnd;
}
