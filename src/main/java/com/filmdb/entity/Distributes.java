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
 * Vertriebsvertrag eines Verleihers für einen Film.
 */
@Entity
@Table(name = "distributes", uniqueConstraints = @UniqueConstraint(name = "uq_distributes", columnNames = {
		"distributor_id", "film_id" }))
@Getter
@Setter
public class Distributes {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "distributor_id", nullable = false)
	private Integer distributorId;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "distribution_fee", precision = 15, scale = 2)
	private BigDecimal distributionFee = BigDecimal.ZERO;

	@Column(name = "distribution_date")
	private LocalDate distributionDate;

	@Column(length = 120)
	private String territory;
}
