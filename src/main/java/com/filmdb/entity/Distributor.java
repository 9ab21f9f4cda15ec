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
 * Verleih mit Marktanteil in Prozent (0 bis 100).
 */
@Entity
@Table(name = "distributor")
@Getter
@Setter
public class Distributor {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 120)
	private String name;

	@Column(length = 80)
	private String region;

	@Column(name = "market_share", precision = 5, scale = 2)
	private BigDecimal marketShare = BigDecimal.ZERO;
}
