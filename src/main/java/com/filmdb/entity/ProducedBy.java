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
 * Join-Tabelle zwischen Film und Produzent mit Investitionssumme.
 */
@Entity
@Table(name = "produced_by", uniqueConstraints = @UniqueConstraint(name = "uq_produced_by", columnNames = {
		"film_id", "producer_id" }))
@Getter
@Setter
public class ProducedBy {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "producer_id", nullable = false)
	private Integer producerId;

	@Column(precision = 15, scale = 2)
	private BigDecimal investment = BigDecimal.ZERO;
}
