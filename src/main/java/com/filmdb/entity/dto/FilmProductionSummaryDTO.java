package com.filmdb.entity.dto;

import java.math.BigDecimal;

import com.filmdb.entity.ProductionStatus;

/**
 * Produktionsübersicht eines Films mit Anzahl beteiligter Schauspieler, Szenen, Crew-Mitglieder und Drehorte.
 */
public record FilmProductionSummaryDTO(
		Integer filmId,
		String title,
		ProductionStatus productionStatus,
		BigDecimal budget,
		Integer duration,
		String directorName,
		long actorCount,
		long sceneCount,
		long crewCount,
		long locationCount) {
}
