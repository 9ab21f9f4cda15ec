package com.filmdb.resource;

import java.util.List;

import jakarta.inject.Inject;

import com.filmdb.entity.Capability;
import com.filmdb.entity.Film;
import com.filmdb.entity.FilmCertificate;
import com.filmdb.entity.FilmGenre;
import com.filmdb.entity.Role;
import com.filmdb.entity.Scene;
import com.filmdb.service.AccessControlService;
import com.filmdb.service.CastingService;
import com.filmdb.service.FilmService;

import io.micrometer.core.annotation.Timed;

/**
 * Implementierung der Film-Endpunkte. Lesende Aufrufe verlangen READ, schreibende WRITE.
 */
public class FilmResourceImpl implements FilmResource {

	@Inject
	FilmService filmService;

	@Inject
	CastingService castingService;

	@Inject
	AccessControlService accessControlService;

	@Override
	public List<Film> listFilms(String caller) {
		accessControlService.requireCapability(caller, Capability.READ);
		return filmService.listFilms();
	}

	@Override
	public Film getFilm(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return filmService.getFilm(filmId);
	}

	@Override
	@Timed(value = "filmdb.http.film.create", description = "Laufzeit des Anlegens eines Films")
	public Film createFilm(String caller, Film film) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		film.setId(null);
		return filmService.createFilm(film);
	}

	@Override
	@Timed(value = "filmdb.http.film.update", description = "Laufzeit der Aktualisierung eines Films")
	public Film updateFilm(String caller, int filmId, Film film) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return filmService.updateFilm(filmId, film);
	}

	@Override
	public void deleteFilm(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		filmService.deleteFilm(filmId);
	}

	@Override
	public List<Scene> listScenes(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return filmService.scenesOf(filmId);
	}

	@Override
	public Scene addScene(String caller, int filmId, Scene scene) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		scene.setId(null);
		scene.setFilmId(filmId);
		return filmService.addScene(scene);
	}

	@Override
	public Scene updateScene(String caller, int sceneId, Scene scene) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return filmService.updateScene(sceneId, scene);
	}

	@Override
	public void deleteScene(String caller, int sceneId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		filmService.deleteScene(sceneId);
	}

	@Override
	public FilmCertificate getCertificate(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return filmService.certificateOf(filmId);
	}

	@Override
	public FilmCertificate issueCertificate(String caller, int filmId, FilmCertificate certificate) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		certificate.setId(null);
		certificate.setFilmId(filmId);
		return filmService.issueCertificate(certificate);
	}

	@Override
	public FilmCertificate updateCertificate(String caller, int filmId, FilmCertificate certificate) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return filmService.updateCertificate(filmId, certificate);
	}

	@Override
	public void revokeCertificate(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		filmService.revokeCertificate(filmId);
	}

	@Override
	public List<FilmGenre> listGenres(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return filmService.genresOf(filmId);
	}

	@Override
	public FilmGenre addGenre(String caller, int filmId, String genre, boolean primary) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return filmService.addGenre(filmId, genre, primary);
	}

	@Override
	public void removeGenre(String caller, int filmId, String genre) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		filmService.removeGenre(filmId, genre);
	}

	@Override
	public List<Role> listRoles(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return castingService.rolesForFilm(filmId);
	}

	@Override
	@Timed(value = "filmdb.http.role.update", description = "Laufzeit der Änderung einer Rolle")
	public Role updateRole(String caller, int roleId, Role role) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return castingService.updateRole(roleId, role);
	}

	@Override
	public void removeRole(String caller, int roleId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		castingService.removeRole(roleId);
	}
}
