package com.filmdb.resource;

import java.util.List;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import com.filmdb.entity.EquipmentAudit;
import com.filmdb.entity.FilmAudit;
import com.filmdb.entity.RoleAudit;
import com.filmdb.entity.UserActivityLog;

/**
 * Nur lesender Zugriff auf die Audit-Protokolle. Zeitgrenzen im ISO-8601-Format, z. B. 2024-01-31T00:00:00Z.
 */
@Path("/audit")
@Produces(MediaType.APPLICATION_JSON)
public interface AuditResource {

	@GET
	@Path("/roles")
	List<RoleAudit> roleAudits(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@QueryParam("actorId") Integer actorId, @QueryParam("filmId") Integer filmId,
			@QueryParam("from") String from, @QueryParam("to") String to);

	@GET
	@Path("/equipment")
	List<EquipmentAudit> equipmentAudits(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@QueryParam("equipmentId") Integer equipmentId, @QueryParam("from") String from,
			@QueryParam("to") String to);

	@GET
	@Path("/films")
	List<FilmAudit> filmAudits(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@QueryParam("filmId") Integer filmId, @QueryParam("from") String from, @QueryParam("to") String to);

	/**
	 * Aktivitätsprotokoll der Benutzerverwaltung; nur für Admins.
	 */
	@GET
	@Path("/users")
	List<UserActivityLog> userActivity(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@QueryParam("username") String username, @QueryParam("from") String from, @QueryParam("to") String to);
}
