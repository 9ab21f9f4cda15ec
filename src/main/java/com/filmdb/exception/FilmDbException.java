package com.filmdb.exception;

/**
 * Basisklasse aller fachlichen Fehler. Jeder Fehler trägt eine stabile {@link ErrorKind} und eine lesbare Meldung.
 */
public abstract class FilmDbException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	protected FilmDbException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}
}
