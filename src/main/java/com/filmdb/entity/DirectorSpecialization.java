package com.filmdb.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "director_specialization", uniqueConstraints = @UniqueConstraint(name = "uq_director_specialization", columnNames = {
		"director_id", "specialization" }))
@Getter
@Setter
public class DirectorSpecialization {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "director_id", nullable = false)
	private Integer directorId;

	@Column(nullable = false, length = 80)
	private String specialization;

	@Column(name = "years_experience")
	private Integer yearsExperience = 0;
}
