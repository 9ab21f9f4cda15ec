package com.filmdb.resource;

import java.util.List;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import com.filmdb.entity.Distributes;
import com.filmdb.entity.EquipmentUsage;
import com.filmdb.entity.FilmCrewEquipment;
import com.filmdb.entity.Hosts;
import com.filmdb.entity.ProducedBy;
import com.filmdb.entity.SceneFilming;
import com.filmdb.entity.ShotAt;
import com.filmdb.entity.WorksOn;

/**
 * REST-Resource für die Verknüpfungen eines Films mit Produzenten, Verleihern, Studios, Crew, Drehorten,
 * Equipment und Drehprotokollen. Angelegt wird unter dem Film, geändert und gelöscht über die ID der
 * Verknüpfung.
 */
@Path("/links")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface ProductionLinkResource {

	@GET
	@Path("/films/{filmId}/producers")
	List<ProducedBy> listProducers(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/producers")
	ProducedBy addProducer(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("filmId") int filmId,
			ProducedBy producedBy);

	@PUT
	@Path("/producers/{linkId}")
	ProducedBy updateProducer(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId,
			ProducedBy producedBy);

	@DELETE
	@Path("/producers/{linkId}")
	void removeProducer(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);

	@GET
	@Path("/films/{filmId}/distributions")
	List<Distributes> listDistributions(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/distributions")
	Distributes addDistribution(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("filmId") int filmId,
			Distributes distributes);

	@PUT
	@Path("/distributions/{linkId}")
	Distributes updateDistribution(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId,
			Distributes distributes);

	@DELETE
	@Path("/distributions/{linkId}")
	void removeDistribution(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);

	@GET
	@Path("/films/{filmId}/studio-rentals")
	List<Hosts> listStudioRentals(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/studio-rentals")
	Hosts addStudioRental(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("filmId") int filmId,
			Hosts hosts);

	@PUT
	@Path("/studio-rentals/{linkId}")
	Hosts updateStudioRental(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId,
			Hosts hosts);

	@DELETE
	@Path("/studio-rentals/{linkId}")
	void removeStudioRental(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);

	@GET
	@Path("/films/{filmId}/crew")
	List<WorksOn> listCrewAssignments(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/crew")
	WorksOn addCrewAssignment(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("filmId") int filmId,
			WorksOn worksOn);

	@PUT
	@Path("/crew/{linkId}")
	WorksOn updateCrewAssignment(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId,
			WorksOn worksOn);

	@DELETE
	@Path("/crew/{linkId}")
	void removeCrewAssignment(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);

	@GET
	@Path("/films/{filmId}/locations")
	List<ShotAt> listLocationBookings(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/locations")
	ShotAt addLocationBooking(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("filmId") int filmId,
			ShotAt shotAt);

	@PUT
	@Path("/locations/{linkId}")
	ShotAt updateLocationBooking(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId,
			ShotAt shotAt);

	@DELETE
	@Path("/locations/{linkId}")
	void removeLocationBooking(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);

	@GET
	@Path("/films/{filmId}/equipment")
	List<EquipmentUsage> listEquipmentUsages(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/equipment")
	EquipmentUsage addEquipmentUsage(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("filmId") int filmId,
			EquipmentUsage equipmentUsage);

	@PUT
	@Path("/equipment/{linkId}")
	EquipmentUsage updateEquipmentUsage(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId,
			EquipmentUsage equipmentUsage);

	@DELETE
	@Path("/equipment/{linkId}")
	void removeEquipmentUsage(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);

	@GET
	@Path("/films/{filmId}/crew-equipment")
	List<FilmCrewEquipment> listCrewEquipment(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/crew-equipment")
	FilmCrewEquipment addCrewEquipment(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId, FilmCrewEquipment assignment);

	@PUT
	@Path("/crew-equipment/{linkId}")
	FilmCrewEquipment updateCrewEquipment(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("linkId") int linkId, FilmCrewEquipment assignment);

	@DELETE
	@Path("/crew-equipment/{linkId}")
	void removeCrewEquipment(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);

	@GET
	@Path("/films/{filmId}/filmings")
	List<SceneFilming> listSceneFilmings(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("filmId") int filmId);

	@POST
	@Path("/films/{filmId}/filmings")
	SceneFilming addSceneFilming(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("filmId") int filmId,
			SceneFilming sceneFilming);

	@PUT
	@Path("/filmings/{linkId}")
	SceneFilming updateSceneFilming(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId,
			SceneFilming sceneFilming);

	@DELETE
	@Path("/filmings/{linkId}")
	void removeSceneFilming(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("linkId") int linkId);
}
