package com.filmdb.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import lombok.Getter;
import lombok.Setter;

/**
 * Auszeichnung eines Regisseurs.
 */
@Entity
@Table(name = "director_award", uniqueConstraints = @UniqueConstraint(name = "uq_director_award", columnNames = {
		"director_id", "award_name", "award_year" }))
@Getter
@Setter
public class DirectorAward extends Award {
	@Column(name = "director_id", nullable = false)
	private Integer directorId;

	@Override
	public Integer getRecipientId() {
		return directorId;
	}

	@Override
	public void setRecipientId(Integer recipientId) {
		this.directorId = recipientId;
	}
}
