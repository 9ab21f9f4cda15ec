package com.filmdb.entity.dto;

import java.math.BigDecimal;

/**
 * Kennzahlen eines Films auf einen Blick.
 */
public record FilmMetricsDTO(
		Integer filmId,
		BigDecimal profit,
		BigDecimal roi,
		long totalCrewMinutes,
		long sceneCount,
		BigDecimal averageCastSalary) {
}
