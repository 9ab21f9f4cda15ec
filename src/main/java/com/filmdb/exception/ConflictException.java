package com.filmdb.exception;

/**
 * Ein Eindeutigkeitsschlüssel (Benutzername, E-Mail, Besetzung) ist bereits belegt.
 */
public class ConflictException extends FilmDbException {

	private static final long serialVersionUID = 1L;

	public ConflictException(String message) {
		super(ErrorKind.CONFLICT, message);
	}
}
