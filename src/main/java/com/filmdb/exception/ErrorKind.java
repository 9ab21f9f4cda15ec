package com.filmdb.exception;

/**
 * Stabile Fehlerarten, die an Aufrufer weitergegeben werden.
 */
public enum ErrorKind {
	VALIDATION,
	AUTHORIZATION,
	CONFLICT,
	INVARIANT,
	NOT_FOUND
}
