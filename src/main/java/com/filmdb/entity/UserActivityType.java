package com.filmdb.entity;

/**
 * Art eines Eintrags im Aktivitätsprotokoll der Benutzerverwaltung.
 */
public enum UserActivityType {
	USER_CREATED,
	USER_STATUS_CHANGE,
	USER_ROLE_CHANGE,
	USER_DELETED,
	USER_LIST_VIEWED,
	LOGIN_SUCCESS,
	LOGIN_FAILED
}
