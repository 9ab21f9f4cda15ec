package com.filmdb.resource;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import org.jboss.logging.Logger;

import com.filmdb.entity.dto.ErrorDTO;
import com.filmdb.exception.ErrorKind;
import com.filmdb.exception.FilmDbException;

/**
 * Übersetzt fachliche Fehler in eine HTTP-Antwort mit stabiler Fehlerart.
 */
@Provider
public class FilmDbExceptionMapper implements ExceptionMapper<FilmDbException> {

	private static final Logger LOG = Logger.getLogger(FilmDbExceptionMapper.class);

	@Override
	public Response toResponse(FilmDbException exception) {
		LOG.debugf("Request failed with %s: %s", exception.getKind(), exception.getMessage());
		return Response.status(statusOf(exception.getKind()))
				.type(MediaType.APPLICATION_JSON)
				.entity(new ErrorDTO(exception.getKind().name(), exception.getMessage()))
				.build();
	}

	static int statusOf(ErrorKind kind) {
		switch (kind) {
		case VALIDATION:
			return 400;
		case AUTHORIZATION:
			return 403;
		case NOT_FOUND:
			return 404;
		case CONFLICT:
			return 409;
		case INVARIANT:
			return 422;
		default:
			return 500;
		}
	}
}
