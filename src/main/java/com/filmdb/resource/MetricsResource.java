package com.filmdb.resource;

import java.math.BigDecimal;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import com.filmdb.entity.dto.FilmMetricsDTO;

/**
 * REST-Resource für einzelne Kennzahlen. Unbekannte IDs liefern Standardwerte statt 404.
 */
@Path("/metrics")
@Produces(MediaType.APPLICATION_JSON)
public interface MetricsResource {

	@GET
	@Path("/films/{id}")
	FilmMetricsDTO filmMetrics(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("id") int filmId);

	@GET
	@Path("/actors/{id}/age")
	int actorAge(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("id") int actorId);

	@GET
	@Path("/actors/{actorId}/films/{filmId}/screen-time")
	long actorScreenTime(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("actorId") int actorId, @PathParam("filmId") int filmId);

	@GET
	@Path("/directors/{id}/film-count")
	long directorFilmCount(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("id") int directorId);

	@GET
	@Path("/producers/{id}/investment")
	BigDecimal producerInvestment(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int producerId);

	@GET
	@Path("/equipment/{id}/availability")
	@Produces(MediaType.TEXT_PLAIN)
	String equipmentAvailability(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int equipmentId);
}
