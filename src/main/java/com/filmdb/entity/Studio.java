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
 * Filmstudio mit Kapazität und Ausstattung.
 */
@Entity
@Table(name = "studio")
@Getter
@Setter
public class Studio {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 120)
	private String name;

	@Column(length = 200)
	private String location;

	@Column(name = "established_year")
	private Integer establishedYear;

	private Integer capacity;

	@Column(columnDefinition = "TEXT")
	private String facilities;
}
