package com.filmdb.entity.dto;

import java.math.BigDecimal;

/**
 * Equipment-Einsatz eines Crew-Mitglieds in einem Film. Drehs und beteiligte Crew zählen alle Drehprotokolle des
 * Films mit diesem Equipment.
 */
public record EquipmentUsageReportEntryDTO(
		Integer equipmentId,
		String name,
		String type,
		BigDecimal cost,
		Integer crewId,
		Integer daysUsed,
		BigDecimal efficiencyRating,
		boolean maintenanceRequired,
		long timesUsed,
		long crewMembersUsed) {
}
