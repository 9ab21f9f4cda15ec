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
 * Arbeitszuordnung eines Crew-Mitglieds zu einem Film. Die Abteilung wird aus dem Crew-Datensatz übernommen.
 */
@Entity
@Table(name = "works_on", uniqueConstraints = @UniqueConstraint(name = "uq_works_on", columnNames = { "crew_id",
		"film_id" }))
@Getter
@Setter
public class WorksOn {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "crew_id", nullable = false)
	private Integer crewId;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "start_date")
	private LocalDate startDate;

	@Column(name = "end_date")
	private LocalDate endDate;

	@Column(length = 80)
	private String department;
}
