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

/**
 * Join-Tabelle zwischen Film und Genre.
 */
@Entity
@Table(name = "film_genre", uniqueConstraints = @UniqueConstraint(name = "uq_film_genre", columnNames = { "film_id",
		"genre" }))
@Getter
@Setter
public class FilmGenre {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(nullable = false, length = 60)
	private String genre;

	@Column(name = "is_primary")
	private Boolean primary = Boolean.FALSE;
}
