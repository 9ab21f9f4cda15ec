package com.filmdb.entity;

/**
 * Aktionskennzeichen der Audit-Tabellen für Besetzung, Equipment und Filme.
 */
public enum AuditAction {
	INSERT,
	DELETE,
	UPDATE,
	STATUS_CHANGE,
	STATUS_UPDATE
}
