package com.filmdb.entity.dto;

import java.math.BigDecimal;

import com.filmdb.entity.Importance;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anfrage zur Besetzung einer Rolle.
 */
@Data
@NoArgsConstructor
public class CastActorRequestDTO {

	private Integer actorId;

	private Integer filmId;

	private String characterName;

	/** LEAD, SUPPORTING oder CAMEO */
	private Importance importance;

	private BigDecimal salary;
}
