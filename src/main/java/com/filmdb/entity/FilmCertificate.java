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
 * Altersfreigabe eines Films (1:1 über die eindeutige film_id).
 */
@Entity
@Table(name = "film_certificate")
@Getter
@Setter
public class FilmCertificate {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false, unique = true)
	private Integer filmId;

	@Column(name = "rating_board", nullable = false, length = 80)
	private String ratingBoard;

	@Column(name = "certificate_rating", nullable = false, length = 20)
	private String certificateRating;

	@Column(name = "issue_date", nullable = false)
	private LocalDate issueDate;

	@Column(name = "expiry_date")
	private LocalDate expiryDate;

	@Column(name = "content_warnings", columnDefinition = "TEXT")
	private String contentWarnings;
}
