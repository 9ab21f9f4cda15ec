package com.filmdb.entity;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.Getter;
import lombok.Setter;

/**
 * Crew-Mitglied. Die Vorgesetzten-Beziehung wird nur als ID gehalten; beim Löschen des Vorgesetzten wird sie genullt.
 */
@Entity
@Table(name = "crew")
@Getter
@Setter
public class Crew {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 120)
	private String name;

	@Column(name = "job_title", nullable = false, length = 60)
	private String jobTitle;

	@Column(name = "date_of_birth")
	private LocalDate dateOfBirth;

	@Column(name = "experience_years")
	private Integer experienceYears = 0;

	@Column(length = 60)
	private String department;

	@Column(name = "supervisor_id")
	private Integer supervisorId;
}
