package com.filmdb.entity;

/**
 * Verfügbarkeit eines Equipment-Stücks.
 */
public enum Availability {
	AVAILABLE,
	IN_USE,
	UNDER_MAINTENANCE
}
