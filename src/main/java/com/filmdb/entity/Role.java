package com.filmdb.entity;

import java.math.BigDecimal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.Getter;
import lombok.Setter;

/**
 * Besetzung eines Schauspielers in einem Film inklusive gespieltem Charakter und Gage.
 */
@Entity
@Table(name = "casting_role", uniqueConstraints = @UniqueConstraint(name = "uq_casting_role", columnNames = {
		"actor_id", "film_id", "character_name" }))
@Getter
@Setter
public class Role {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "actor_id", nullable = false)
	private Integer actorId;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "character_name", length = 120)
	private String characterName;

	/** Leinwandzeit in Minuten */
	@Column(name = "screen_time")
	private Integer screenTime;

	@Enumerated(EnumType.STRING)
	@Column(length = 20)
	private Importance importance = Importance.SUPPORTING;

	@Column(precision = 14, scale = 2)
	private BigDecimal salary = BigDecimal.ZERO;
}
