package com.filmdb.entity.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.filmdb.entity.Importance;

/**
 * Eine Rolle in der Filmografie eines Schauspielers.
 */
public record ActorFilmographyEntryDTO(
		Integer filmId,
		String title,
		LocalDate releaseDate,
		Integer duration,
		String language,
		String characterName,
		Integer screenTime,
		Importance importance,
		BigDecimal salary,
		String directorName) {
}
