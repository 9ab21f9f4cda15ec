package com.filmdb.resource;

import java.util.List;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import com.filmdb.entity.dto.ActorAwardHistoryDTO;
import com.filmdb.entity.dto.ActorFilmographyEntryDTO;
import com.filmdb.entity.dto.BoxOfficeEntryDTO;
import com.filmdb.entity.dto.CrewPayrollEntryDTO;
import com.filmdb.entity.dto.DirectorFilmographyEntryDTO;
import com.filmdb.entity.dto.DistributorPerformanceDTO;
import com.filmdb.entity.dto.EquipmentUsageReportEntryDTO;
import com.filmdb.entity.dto.FilmProductionSummaryDTO;
import com.filmdb.entity.dto.ProducerInvestmentSummaryDTO;

/**
 * REST-Resource für lesende Auswertungen.
 * Die Endpunkte werden von {@link ReportResourceImpl} implementiert.
 */
@Path("/reports")
@Produces(MediaType.APPLICATION_JSON)
public interface ReportResource {

	@GET
	@Path("/films/{id}/summary")
	FilmProductionSummaryDTO productionSummary(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int filmId);

	@GET
	@Path("/films/{id}/crew-payroll")
	List<CrewPayrollEntryDTO> crewPayroll(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int filmId);

	@GET
	@Path("/films/{id}/equipment-usage")
	List<EquipmentUsageReportEntryDTO> equipmentUsage(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int filmId);

	@GET
	@Path("/actors/{id}/awards")
	ActorAwardHistoryDTO actorAwards(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int actorId);

	@GET
	@Path("/actors/{id}/filmography")
	List<ActorFilmographyEntryDTO> actorFilmography(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int actorId);

	@GET
	@Path("/directors/{id}/filmography")
	List<DirectorFilmographyEntryDTO> directorFilmography(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int directorId);

	@GET
	@Path("/producers/{id}/investment")
	ProducerInvestmentSummaryDTO producerInvestment(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("id") int producerId);

	@GET
	@Path("/box-office")
	List<BoxOfficeEntryDTO> boxOffice(@HeaderParam(FilmResource.CALLER_HEADER) String caller);

	@GET
	@Path("/distributors")
	List<DistributorPerformanceDTO> distributorPerformance(@HeaderParam(FilmResource.CALLER_HEADER) String caller);
}
