package com.filmdb.entity.dto;

import java.math.BigDecimal;

/**
 * Verleiherkennzahlen: Anzahl vertriebener Filme, Summe der Gebühren und durchschnittliches Einspielergebnis.
 */
public record DistributorPerformanceDTO(
		Integer distributorId,
		String name,
		String region,
		BigDecimal marketShare,
		long filmsDistributed,
		BigDecimal totalFees,
		BigDecimal averageBoxOffice) {
}
