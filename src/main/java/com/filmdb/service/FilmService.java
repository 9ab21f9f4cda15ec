package com.filmdb.service;

import java.math.BigDecimal;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import com.filmdb.entity.Film;
import com.filmdb.entity.FilmCertificate;
import com.filmdb.entity.FilmGenre;
import com.filmdb.entity.ProductionStatus;
import com.filmdb.entity.Scene;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.DirectorRepository;
import com.filmdb.repository.FilmCertificateRepository;
import com.filmdb.repository.FilmGenreRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.SceneFilmingRepository;
import com.filmdb.repository.SceneRepository;

/**
 * Service für Filme samt Szenen, Altersfreigabe und Genre-Zuordnung.
 * <p>
 * Jede Änderung eines Films läuft über {@link #updateFilm(Integer, Film)}: der vorgeschlagene Zustand wird
 * zuerst geprüft und erst danach auf die verwaltete Entität übertragen. Ein Statuswechsel erzeugt dabei
 * einen Audit-Eintrag STATUS_CHANGE.
 */
@ApplicationScoped
public class FilmService {

	private static final Logger LOG = Logger.getLogger(FilmService.class);

	@Inject
	FilmRepository filmRepository;

	@Inject
	DirectorRepository directorRepository;

	@Inject
	SceneRepository sceneRepository;

	@Inject
	SceneFilmingRepository sceneFilmingRepository;

	@Inject
	FilmCertificateRepository certificateRepository;

	@Inject
	FilmGenreRepository genreRepository;

	@Inject
	ValidationService validationService;

	@Inject
	AuditService auditService;

	@Inject
	CastingService castingService;

	@Inject
	ProductionLinkService productionLinkService;

	public Film getFilm(Integer filmId) {
		return filmRepository.findById(filmId).orElseThrow(() -> RecordNotFoundException.of("Film", filmId));
	}

	public List<Film> listFilms() {
		return filmRepository.listAll();
	}

	@Transactional
	public Film createFilm(Film film) {
		validationService.validateFilmInsert(film);
		requireDirector(film.getDirectorId());
		if (film.getProductionStatus() == null)
			film.setProductionStatus(ProductionStatus.PRE_PRODUCTION);
		filmRepository.persist(film);
		LOG.infof("Created film %d '%s' (budget %s)", film.getId(), film.getTitle(), film.getBudget());
		return film;
	}

	/**
	 * Überträgt alle fachlichen Felder von {@code changes} auf den gespeicherten Film. Schlägt die Prüfung fehl,
	 * bleibt der gespeicherte Film unverändert.
	 */
	@Transactional
	public Film updateFilm(Integer filmId, Film changes) {
		Film film = getFilm(filmId);
		if (changes.getProductionStatus() == null)
			changes.setProductionStatus(film.getProductionStatus());
		validationService.validateFilmUpdate(film, changes);
		requireDirector(changes.getDirectorId());

		ProductionStatus oldStatus = film.getProductionStatus();
		BigDecimal oldBudget = film.getBudget();

		film.setTitle(changes.getTitle());
		film.setReleaseDate(changes.getReleaseDate());
		film.setBudget(changes.getBudget());
		film.setDuration(changes.getDuration());
		film.setLanguage(changes.getLanguage());
		film.setBoxOfficeCollection(changes.getBoxOfficeCollection());
		film.setRating(changes.getRating());
		film.setPrimaryGenre(changes.getPrimaryGenre());
		film.setDirectorId(changes.getDirectorId());
		film.setProductionStatus(changes.getProductionStatus());

		auditService.recordStatusChange(film, oldStatus, oldBudget);
		return film;
	}

	/**
	 * Setzt nur den Produktionsstatus. Läuft durch dieselbe Prüfung wie jede andere Film-Aktualisierung.
	 */
	@Transactional
	public Film changeProductionStatus(Integer filmId, ProductionStatus status) {
		if (status == null)
			throw new ValidationException("Production status is required");
		Film film = getFilm(filmId);
		Film changes = copyOf(film);
		changes.setProductionStatus(status);
		return updateFilm(filmId, changes);
	}

	/**
	 * Löscht einen Film mit allen abhängigen Datensätzen. Rollen werden einzeln entfernt und auditiert.
	 */
	@Transactional
	public void deleteFilm(Integer filmId) {
		Film film = getFilm(filmId);
		int roles = castingService.removeRolesForFilm(filmId);
		productionLinkService.deleteLinksForFilm(filmId);
		sceneRepository.deleteByFilmId(filmId);
		certificateRepository.deleteByFilmId(filmId);
		genreRepository.deleteByFilmId(filmId);
		filmRepository.delete(film);
		LOG.infof("Deleted film %d '%s' with %d roles", filmId, film.getTitle(), roles);
	}

	public List<Scene> scenesOf(Integer filmId) {
		return sceneRepository.findByFilmId(filmId);
	}

	public Scene getScene(Integer sceneId) {
		return sceneRepository.findById(sceneId).orElseThrow(() -> RecordNotFoundException.of("Scene", sceneId));
	}

	@Transactional
	public Scene addScene(Scene scene) {
		getFilm(scene.getFilmId());
		checkSceneDuration(scene);
		sceneRepository.persist(scene);
		return scene;
	}

	/**
	 * Ändert Drehort, Beschreibung und Dauer einer Szene; die Zugehörigkeit zum Film bleibt.
	 */
	@Transactional
	public Scene updateScene(Integer sceneId, Scene changes) {
		Scene scene = getScene(sceneId);
		checkSceneDuration(changes);
		scene.setLocation(changes.getLocation());
		scene.setDescription(changes.getDescription());
		scene.setDuration(changes.getDuration());
		return scene;
	}

	@Transactional
	public void deleteScene(Integer sceneId) {
		Scene scene = getScene(sceneId);
		sceneFilmingRepository.deleteBySceneId(sceneId);
		sceneRepository.delete(scene);
	}

	public FilmCertificate certificateOf(Integer filmId) {
		return certificateRepository.findByFilmId(filmId)
				.orElseThrow(() -> RecordNotFoundException.of("FilmCertificate for film", filmId));
	}

	/**
	 * Jeder Film hat höchstens eine Altersfreigabe.
	 */
	@Transactional
	public FilmCertificate issueCertificate(FilmCertificate certificate) {
		getFilm(certificate.getFilmId());
		if (certificateRepository.findByFilmId(certificate.getFilmId()).isPresent())
			throw new ConflictException("Film " + certificate.getFilmId() + " already has a certificate");
		checkCertificateDates(certificate);
		certificateRepository.persist(certificate);
		return certificate;
	}

	@Transactional
	public FilmCertificate updateCertificate(Integer filmId, FilmCertificate changes) {
		FilmCertificate certificate = certificateOf(filmId);
		checkCertificateDates(changes);
		certificate.setRatingBoard(changes.getRatingBoard());
		certificate.setCertificateRating(changes.getCertificateRating());
		certificate.setIssueDate(changes.getIssueDate());
		certificate.setExpiryDate(changes.getExpiryDate());
		certificate.setContentWarnings(changes.getContentWarnings());
		return certificate;
	}

	@Transactional
	public void revokeCertificate(Integer filmId) {
		certificateRepository.delete(certificateOf(filmId));
	}

	public List<FilmGenre> genresOf(Integer filmId) {
		return genreRepository.findByFilmId(filmId);
	}

	@Transactional
	public FilmGenre addGenre(Integer filmId, String genre, boolean primary) {
		getFilm(filmId);
		if (genre == null || genre.isBlank())
			throw new ValidationException("Genre name is required");
		String name = genre.trim();
		if (genreRepository.existsByFilmIdAndGenre(filmId, name))
			throw new ConflictException("Film " + filmId + " already has genre " + name);
		FilmGenre filmGenre = new FilmGenre();
		filmGenre.setFilmId(filmId);
		filmGenre.setGenre(name);
		filmGenre.setPrimary(primary);
		genreRepository.persist(filmGenre);
		return filmGenre;
	}

	/**
	 * Entfernt ein Genre. War es das Hauptgenre, wird das Hauptgenre des Films geleert.
	 */
	@Transactional
	public void removeGenre(Integer filmId, String genre) {
		Film film = getFilm(filmId);
		String name = genre == null ? null : genre.trim();
		FilmGenre filmGenre = genreRepository.findByFilmIdAndGenre(filmId, name)
				.orElseThrow(() -> new RecordNotFoundException("Film " + filmId + " has no genre " + name));
		genreRepository.delete(filmGenre);
		if (name.equals(film.getPrimaryGenre()))
			film.setPrimaryGenre(null);
	}

	private void requireDirector(Integer directorId) {
		if (directorId != null && !directorRepository.existsById(directorId))
			throw RecordNotFoundException.of("Director", directorId);
	}

	private static void checkSceneDuration(Scene scene) {
		if (scene.getDuration() != null && scene.getDuration() < 0)
			throw new ValidationException("Scene duration cannot be negative");
	}

	private static void checkCertificateDates(FilmCertificate certificate) {
		if (certificate.getIssueDate() != null && certificate.getExpiryDate() != null
				&& certificate.getExpiryDate().isBefore(certificate.getIssueDate()))
			throw new ValidationException("Certificate expiry date cannot be before issue date");
	}

	private static Film copyOf(Film film) {
		Film copy = new Film();
		copy.setTitle(film.getTitle());
		copy.setReleaseDate(film.getReleaseDate());
		copy.setBudget(film.getBudget());
		copy.setDuration(film.getDuration());
		copy.setLanguage(film.getLanguage());
		copy.setBoxOfficeCollection(film.getBoxOfficeCollection());
		copy.setRating(film.getRating());
		copy.setPrimaryGenre(film.getPrimaryGenre());
		copy.setDirectorId(film.getDirectorId());
		copy.setProductionStatus(film.getProductionStatus());
		return copy;
	}
}
