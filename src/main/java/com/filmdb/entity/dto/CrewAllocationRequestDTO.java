package com.filmdb.entity.dto;

import java.time.LocalDate;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Anfrage zur Zuteilung eines Crew-Mitglieds. Die Abteilung stammt aus dem Crew-Datensatz.
 */
@Data
@NoArgsConstructor
public class CrewAllocationRequestDTO {

	private Integer crewId;

	private Integer filmId;

	private LocalDate startDate;

	private LocalDate endDate;
}
