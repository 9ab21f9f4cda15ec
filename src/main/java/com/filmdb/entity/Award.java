package com.filmdb.entity;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;

import lombok.Getter;
import lombok.Setter;

/**
 * Gemeinsame Felder einer Auszeichnung. Name und Jahr sind je Person eindeutig.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class Award {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "award_name", nullable = false, length = 200)
	private String awardName;

	@Column(name = "award_year", nullable = false)
	private Integer awardYear;

	/**
	 * ID der ausgezeichneten Person.
	 */
	public abstract Integer getRecipientId();

	public abstract void setRecipientId(Integer recipientId);
}
