package com.filmdb.entity;

/**
 * Sprachniveau eines Schauspielers.
 */
public enum FluencyLevel {
	BASIC,
	CONVERSATIONAL,
	FLUENT,
	NATIVE
}
