package com.filmdb.entity.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Zeile der Einspielergebnis-Auswertung.
 */
public record BoxOfficeEntryDTO(
		Integer filmId,
		String title,
		LocalDate releaseDate,
		BigDecimal budget,
		BigDecimal boxOfficeCollection,
		BigDecimal profit,
		BigDecimal roi,
		String directorName,
		long castSize) {
}
