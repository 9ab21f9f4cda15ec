package com.filmdb.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.Getter;
import lombok.Setter;

/**
 * Auszeichnung eines Schauspielers.
 */
@Entity
@Table(name = "actor_award", uniqueConstraints = @UniqueConstraint(name = "uq_actor_award", columnNames = {
		"actor_id", "award_name", "award_year" }))
@Getter
@Setter
public class ActorAward extends Award {
	@Column(name = "actor_id", nullable = false)
	private Integer actorId;

	@Override
	public Integer getRecipientId() {
		return actorId;
	}

	@Override
	public void setRecipientId(Integer recipientId) {
		this.actorId = recipientId;
	}
}
