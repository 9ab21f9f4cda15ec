package com.filmdb.entity.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anfrage zum Buchen eines Drehorts für einen Film.
 */
@Data
@NoArgsConstructor
public class ShootingLocationRequestDTO {

	private Integer filmId;

	/** Name des Drehorts; zusammen mit der Stadt der Schlüssel für die Wiederverwendung */
	private String name;

	private String city;

	private String country;

	private LocalDate shootingStart;

	private LocalDate shootingEnd;

	private BigDecimal costPerDay;
}
