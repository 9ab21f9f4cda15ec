package com.filmdb.resource;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import com.filmdb.entity.Availability;
import com.filmdb.entity.Film;
import com.filmdb.entity.ProductionStatus;
import com.filmdb.entity.Role;
import com.filmdb.entity.WorksOn;
import com.filmdb.entity.dto.CastActorRequestDTO;
import com.filmdb.entity.dto.CrewAllocationRequestDTO;
import com.filmdb.entity.dto.FilmWithGenresRequestDTO;
import com.filmdb.entity.dto.LoginRequestDTO;
import com.filmdb.entity.dto.OperationResultDTO;
import com.filmdb.entity.dto.ShootingLocationRequestDTO;
import com.filmdb.entity.dto.ShootingLocationResultDTO;

/**
 * REST-Resource für die zusammengesetzten Produktionsoperationen.
 * Die Endpunkte werden von {@link OperationsResourceImpl} implementiert.
 */
@Path("/operations")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface OperationsResource {

	@POST
	@Path("/cast")
	Role castActor(@HeaderParam(FilmResource.CALLER_HEADER) String caller, CastActorRequestDTO request);

	@POST
	@Path("/crew-allocations")
	WorksOn allocateCrew(@HeaderParam(FilmResource.CALLER_HEADER) String caller, CrewAllocationRequestDTO request);

	/**
	 * Bucht einen Drehort für einen Film und berechnet die Gesamtkosten.
	 *
	 * @return verwendeter Drehort, Drehtage und Kosten
	 */
	@POST
	@Path("/shooting-locations")
	ShootingLocationResultDTO addShootingLocation(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			ShootingLocationRequestDTO request);

	@PUT
	@Path("/films/{id}/status")
	OperationResultDTO updateProductionStatus(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int filmId, @QueryParam("status") ProductionStatus status);

	@PUT
	@Path("/equipment/{id}/status")
	OperationResultDTO updateEquipmentStatus(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int equipmentId, @QueryParam("availability") Availability availability);

	@POST
	@Path("/films")
	Film addFilmWithGenres(@HeaderParam(FilmResource.CALLER_HEADER) String caller, FilmWithGenresRequestDTO request);

	/**
	 * Nimmt das Ergebnis eines Anmeldeversuchs der vorgelagerten Anmeldung entgegen.
	 */
	@POST
	@Path("/logins")
	void recordLogin(LoginRequestDTO request);
}
