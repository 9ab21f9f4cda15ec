package com.filmdb.service;

/**
 * Ergebnis der Identitätsprüfung eines Benutzernamens.
 */
public enum AuthenticationResult {
	AUTHORIZED,
	NOT_FOUND,
	INACTIVE
}
