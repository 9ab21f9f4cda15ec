package com.filmdb.entity.dto;

import java.math.BigDecimal;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anfrage zum Anlegen eines Films samt Genres.
 */
@Data
@NoArgsConstructor
public class FilmWithGenresRequestDTO {

	private String title;

	private BigDecimal budget;

	private Integer duration;

	private Integer directorId;

	private String language;

	/** Kommagetrennte Genre-Liste, z. B. "Drama, Thriller" */
	private String genres;
}
