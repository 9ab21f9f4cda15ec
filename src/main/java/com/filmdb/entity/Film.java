package com.filmdb.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import lombok.Getter;
import lombok.Setter;

/**
 * JPA-Entity für die film-Tabelle mit Stammdaten, Finanzkennzahlen und Produktionsstatus eines Films.
 */
@Entity
@Table(name = "film")
@Getter
@Setter
public class Film {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 200)
	private String title;

	@Column(name = "release_date")
	private LocalDate releaseDate;

	@Column(precision = 15, scale = 2)
	private BigDecimal budget = BigDecimal.ZERO;

	/** Laufzeit in Minuten */
	private Integer duration;

	@Column(length = 80)
	private String language;

	@Column(name = "boxoffice_collection", precision = 15, scale = 2)
	private BigDecimal boxOfficeCollection = BigDecimal.ZERO;

	@Column(precision = 3, scale = 1)
	private BigDecimal rating;

	@Column(name = "primary_genre", length = 60)
	private String primaryGenre;

	@Column(name = "director_id")
	private Integer directorId;

	@Enumerated(EnumType.STRING)
	@Column(name = "production_status", nullable = false, length = 20)
	private ProductionStatus productionStatus = ProductionStatus.PRE_PRODUCTION;

	@CreationTimestamp
	@Column(name = "created_date", updatable = false)
	private Instant createdDate;

	@UpdateTimestamp
	@Column(name = "updated_date")
	private Instant updatedDate;
}
