package com.filmdb.entity;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.Getter;
import lombok.Setter;

/**
 * Repräsentiert einen Schauspieler. Das Alter wird nicht gespeichert, sondern aus dem Geburtsdatum abgeleitet.
 */
@Entity
@Table(name = "actor")
@Getter
@Setter
public class Actor {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "first_name", nullable = false, length = 60)
	private String firstName;

	@Column(name = "last_name", nullable = false, length = 60)
	private String lastName;

	@Column(name = "date_of_birth")
	private LocalDate dateOfBirth;

	@Enumerated(EnumType.STRING)
	@Column(length = 10)
	private Gender gender = Gender.OTHER;

	@Column(length = 80)
	private String nationality;

	@Column(name = "stage_name", length = 120)
	private String stageName;

	public String getFullName() {
		return firstName + " " + lastName;
	}
}
