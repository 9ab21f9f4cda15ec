package com.filmdb.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.Getter;
import lombok.Setter;

/**
 * Szene eines Films; existiert nur zusammen mit dem Film.
 */
@Entity
@Table(name = "scene")
@Getter
@Setter
public class Scene {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(length = 200)
	private String location;

	@Column(columnDefinition = "TEXT")
	private String description;

	/** Dauer in Minuten */
	private Integer duration;
}
