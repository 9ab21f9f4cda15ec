package com.filmdb.entity;

/**
 * Einzelne Berechtigung innerhalb einer Rollenstufe.
 */
public enum Capability {
	/** Lesender Zugriff auf alle Produktionsdaten. */
	READ,
	/** Anlegen, Ändern und Löschen von Produktionsdaten. */
	WRITE,
	/** Benutzerverwaltung. */
	ADMINISTER
}
