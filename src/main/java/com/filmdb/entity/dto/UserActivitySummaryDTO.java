package com.filmdb.entity.dto;

import java.time.Instant;

import com.filmdb.entity.UserRole;

/**
 * Aktivitätsübersicht je Benutzerkonto.
 */
public record UserActivitySummaryDTO(
		String username,
		String fullName,
		UserRole role,
		boolean active,
		long totalActivities,
		Instant lastActivity,
		long successfulLogins,
		long failedLogins) {
}
