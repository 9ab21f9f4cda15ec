package com.filmdb.exception;

/**
 * Ein referenzierter Datensatz existiert nicht.
 */
public class RecordNotFoundException extends FilmDbException {

	private static final long serialVersionUID = 1L;

	public RecordNotFoundException(String message) {
		super(ErrorKind.NOT_FOUND, message);
	}

	public static RecordNotFoundException of(String entity, Object id) {
		return new RecordNotFoundException(entity + " " + id + " not found");
	}
}
