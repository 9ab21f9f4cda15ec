package com.filmdb.entity.dto;

import java.math.BigDecimal;

/**
 * Ergebnis der Drehortbuchung: verwendeter Drehort, Anzahl Drehtage (beide Grenzen inklusive) und Gesamtkosten.
 */
public record ShootingLocationResultDTO(
		Integer locationId,
		long totalDays,
		BigDecimal totalCost) {
}
