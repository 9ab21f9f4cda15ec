package com.filmdb.entity;

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
 * Dreheinsatz: welches Crew-Mitglied welches Equipment für welche Szene genutzt hat.
 */
@Entity
@Table(name = "scene_filming", uniqueConstraints = @UniqueConstraint(name = "uq_scene_crew_equip", columnNames = {
		"film_id", "scene_id", "crew_id", "equipment_id" }))
@Getter
@Setter
public class SceneFilming {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "scene_id", nullable = false)
	private Integer sceneId;

	@Column(name = "crew_id", nullable = false)
	private Integer crewId;

	@Column(name = "equipment_id")
	private Integer equipmentId;

	@Column(name = "filming_date")
	private LocalDate filmingDate;

	@Column(name = "duration_minutes")
	private Integer durationMinutes;

	@Column(columnDefinition = "TEXT")
	private String notes;
}
