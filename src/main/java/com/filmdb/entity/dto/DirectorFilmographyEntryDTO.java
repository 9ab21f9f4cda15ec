package com.filmdb.entity.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.filmdb.entity.ProductionStatus;

/**
 * Film eines Regisseurs mit Gewinn und Rendite.
 */
public record DirectorFilmographyEntryDTO(
		Integer filmId,
		String title,
		LocalDate releaseDate,
		BigDecimal budget,
		BigDecimal boxOfficeCollection,
		BigDecimal profit,
		BigDecimal roi,
		BigDecimal rating,
		ProductionStatus productionStatus) {
}
