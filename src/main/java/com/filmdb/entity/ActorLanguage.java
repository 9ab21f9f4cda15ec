package com.filmdb.entity;

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
 * Sprache, die ein Schauspieler spricht; je Schauspieler und Sprache ein Eintrag.
 */
@Entity
@Table(name = "actor_language", uniqueConstraints = @UniqueConstraint(name = "uq_actor_language", columnNames = {
		"actor_id", "language" }))
@Getter
@Setter
public class ActorLanguage {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "actor_id", nullable = false)
	private Integer actorId;

	@Column(nullable = false, length = 80)
	private String language;

	@Enumerated(EnumType.STRING)
	@Column(name = "fluency_level", length = 20)
	private FluencyLevel fluencyLevel = FluencyLevel.CONVERSATIONAL;
}
