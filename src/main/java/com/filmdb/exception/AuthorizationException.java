package com.filmdb.exception;

/**
 * Der Aufrufer besitzt nicht die erforderliche Rolle.
 */
public class AuthorizationException extends FilmDbException {

	private static final long serialVersionUID = 1L;

	public AuthorizationException(String message) {
		super(ErrorKind.AUTHORIZATION, message);
	}
}
