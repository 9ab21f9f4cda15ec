package com.filmdb.entity.dto;

import java.math.BigDecimal;

/**
 * Investitionen eines Produzenten über alle Filme. Ohne Beteiligung sind Summe und Kennwerte 0.
 */
public record ProducerInvestmentSummaryDTO(
		Integer producerId,
		String name,
		String company,
		long filmCount,
		BigDecimal totalInvestment,
		BigDecimal averageInvestment,
		BigDecimal maxInvestment,
		BigDecimal minInvestment) {
}
