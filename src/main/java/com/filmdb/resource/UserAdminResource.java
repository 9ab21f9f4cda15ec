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
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import com.filmdb.entity.UserAccount;
import com.filmdb.entity.UserRole;
import com.filmdb.entity.dto.CreateUserRequestDTO;
import com.filmdb.entity.dto.UserActivitySummaryDTO;
import com.filmdb.service.AuthenticationResult;

/**
 * REST-Resource der Benutzerverwaltung. Bis auf die Identitätsprüfung verlangen alle Endpunkte einen Admin.
 */
@Path("/users")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface UserAdminResource {

	@GET
	List<UserAccount> listUsers(@HeaderParam(FilmResource.CALLER_HEADER) String caller);

	@POST
	UserAccount createUser(@HeaderParam(FilmResource.CALLER_HEADER) String caller, CreateUserRequestDTO request);

	@PUT
	@Path("/{username}/status")
	UserAccount updateStatus(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("username") String username, @QueryParam("active") Boolean active);

	@PUT
	@Path("/{username}/role")
	UserAccount changeRole(@HeaderParam(FilmResource.CALLER_HEADER) String caller,
			@PathParam("username") String username, @QueryParam("role") UserRole role);

	@DELETE
	@Path("/{username}")
	void deleteUser(@HeaderParam(FilmResource.CALLER_HEADER) String caller, @PathParam("username") String username);

	@GET
	@Path("/activity")
	List<UserActivitySummaryDTO> activitySummary(@HeaderParam(FilmResource.CALLER_HEADER) String caller);

	@GET
	@Path("/{username}/authentication")
	AuthenticationResult authenticate(@PathParam("username") String username);
}
