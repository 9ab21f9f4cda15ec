package com.filmdb.entity.dto;

import java.time.LocalDate;

/**
 * Lohnrelevante Einsatzdaten eines Crew-Mitglieds in einem Film.
 */
public record CrewPayrollEntryDTO(
		Integer crewId,
		String name,
		String jobTitle,
		String department,
		LocalDate startDate,
		LocalDate endDate,
		long workingDays,
		long shoots,
		long totalMinutes) {
}
