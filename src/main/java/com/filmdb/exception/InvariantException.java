package com.filmdb.exception;

/**
 * Die Operation würde eine strukturelle Garantie verletzen, z. B. den letzten aktiven Admin entfernen.
 */
public class InvariantException extends FilmDbException {

	private static final long serialVersionUID = 1L;

	public InvariantException(String message) {
		super(ErrorKind.INVARIANT, message);
	}
}
