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

import com.filmdb.entity.Film;
import com.filmdb.entity.FilmCertificate;
import com.filmdb.entity.FilmGenre;
import com.filmdb.entity.Role;
import com.filmdb.entity.Scene;

/**
 * REST-Resource für Filme, ihre Szenen, Altersfreigabe, Genres und Besetzung.
 * Die Endpunkte werden von {@link FilmResourceImpl} implementiert.
 */
@Path("/films")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface FilmResource {

	String CALLER_HEADER = "X-Filmdb-User";

	@GET
	List<Film> listFilms(@HeaderParam(CALLER_HEADER) String caller);

	@GET
	@Path("/{id}")
	Film getFilm(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId);

	/**
	 * Legt einen Film an.
	 *
	 * @param caller Benutzername des Aufrufers, benötigt Schreibrecht
	 * @param film   Filmdaten; das Budget muss mindestens 100.000 betragen
	 * @return der gespeicherte Film mit vergebener ID
	 */
	@POST
	Film createFilm(@HeaderParam(CALLER_HEADER) String caller, Film film);

	@PUT
	@Path("/{id}")
	Film updateFilm(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId, Film film);

	@DELETE
	@Path("/{id}")
	void deleteFilm(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId);

	@GET
	@Path("/{id}/scenes")
	List<Scene> listScenes(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId);

	@POST
	@Path("/{id}/scenes")
	Scene addScene(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId, Scene scene);

	@PUT
	@Path("/scenes/{sceneId}")
	Scene updateScene(@HeaderParam(CALLER_HEADER) String caller, @PathParam("sceneId") int sceneId, Scene scene);

	@DELETE
	@Path("/scenes/{sceneId}")
	void deleteScene(@HeaderParam(CALLER_HEADER) String caller, @PathParam("sceneId") int sceneId);

	@GET
	@Path("/{id}/certificate")
	FilmCertificate getCertificate(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId);

	@POST
	@Path("/{id}/certificate")
	FilmCertificate issueCertificate(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId,
			FilmCertificate certificate);

	@PUT
	@Path("/{id}/certificate")
	FilmCertificate updateCertificate(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId,
			FilmCertificate certificate);

	@DELETE
	@Path("/{id}/certificate")
	void revokeCertificate(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId);

	@GET
	@Path("/{id}/genres")
	List<FilmGenre> listGenres(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId);

	@POST
	@Path("/{id}/genres")
	FilmGenre addGenre(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId,
			@QueryParam("genre") String genre, @QueryParam("primary") boolean primary);

	@DELETE
	@Path("/{id}/genres/{genre}")
	void removeGenre(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId,
			@PathParam("genre") String genre);

	@GET
	@Path("/{id}/roles")
	List<Role> listRoles(@HeaderParam(CALLER_HEADER) String caller, @PathParam("id") int filmId);

	@PUT
	@Path("/roles/{roleId}")
	Role updateRole(@HeaderParam(CALLER_HEADER) String caller, @PathParam("roleId") int roleId, Role role);

	@DELETE
	@Path("/roles/{roleId}")
	void removeRole(@HeaderParam(CALLER_HEADER) String caller, @PathParam("roleId") int roleId);
}
