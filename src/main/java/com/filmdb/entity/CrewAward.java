package com.filmdb.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.Getter;
import lombok.Setter;

/**
 * Auszeichnung eines Crew-Mitglieds.
 */
@Entity
@Table(name = "crew_award", uniqueConstraints = @UniqueConstraint(name = "uq_crew_award", columnNames = {
		"crew_id", "award_name", "award_year" }))
@Getter
@Setter
public class CrewAward extends Award {
	@Column(name = "crew_id", nullable = false)
	private Integer crewId;

	@Override
	public Integer getRecipientId() {
		return crewId;
	}

	@Override
	public void setRecipientId(Integer recipientId) {
		this.crewId = recipientId;
	}
}
