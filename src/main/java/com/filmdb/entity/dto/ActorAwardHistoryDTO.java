package com.filmdb.entity.dto;

import java.util.List;

/**
 * Auszeichnungen eines Schauspielers, neuestes Jahr zuerst.
 */
public record ActorAwardHistoryDTO(
		Integer actorId,
		String firstName,
		String lastName,
		String nationality,
		int totalAwards,
		List<AwardEntry> awards) {

	public record AwardEntry(String awardName, Integer awardYear) {
	}
}
