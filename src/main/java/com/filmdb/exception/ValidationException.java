package com.filmdb.exception;

/**
 * Eine Geschäftsregel für einen einzelnen Datensatz wurde verletzt.
 */
public class ValidationException extends FilmDbException {

	private static final long serialVersionUID = 1L;

	public ValidationException(String message) {
		super(ErrorKind.VALIDATION, message);
	}
}
