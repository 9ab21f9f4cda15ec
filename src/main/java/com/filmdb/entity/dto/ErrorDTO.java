package com.filmdb.entity.dto;

/**
 * Fehlerantwort der REST-Schnittstelle mit stabiler Fehlerart und lesbarer Meldung.
 */
public record ErrorDTO(
		String kind,
		String message) {
}
