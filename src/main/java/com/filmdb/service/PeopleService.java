package com.filmdb.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import com.filmdb.entity.Actor;
import com.filmdb.entity.ActorAward;
import com.filmdb.entity.ActorLanguage;
import com.filmdb.entity.Award;
import com.filmdb.entity.Crew;
import com.filmdb.entity.CrewAward;
import com.filmdb.entity.Director;
import com.filmdb.entity.DirectorAward;
import com.filmdb.entity.DirectorSpecialization;
import com.filmdb.entity.Producer;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.ActorAwardRepository;
import com.filmdb.repository.ActorLanguageRepository;
import com.filmdb.repository.ActorRepository;
import com.filmdb.repository.AwardRepository;
import com.filmdb.repository.CrewAwardRepository;
import com.filmdb.repository.CrewRepository;
import com.filmdb.repository.DirectorAwardRepository;
import com.filmdb.repository.DirectorRepository;
import com.filmdb.repository.DirectorSpecializationRepository;
import com.filmdb.repository.FilmCrewEquipmentRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.ProducedByRepository;
import com.filmdb.repository.ProducerRepository;
import com.filmdb.repository.SceneFilmingRepository;
import com.filmdb.repository.WorksOnRepository;

/**
 * Stammdaten der beteiligten Personen: Schauspieler, Regisseure, Produzenten und Crew.
 */
@ApplicationScoped
public class PeopleService {

	private static final Logger LOG = Logger.getLogger(PeopleService.class);

	@Inject
	ActorRepository actorRepository;

	@Inject
	DirectorRepository directorRepository;

	@Inject
	ProducerRepository producerRepository;

	@Inject
	CrewRepository crewRepository;

	@Inject
	FilmRepository filmRepository;

	@Inject
	ProducedByRepository producedByRepository;

	@Inject
	WorksOnRepository worksOnRepository;

	@Inject
	SceneFilmingRepository sceneFilmingRepository;

	@Inject
	FilmCrewEquipmentRepository crewEquipmentRepository;

	@Inject
	ActorAwardRepository actorAwardRepository;

	@Inject
	DirectorAwardRepository directorAwardRepository;

	@Inject
	CrewAwardRepository crewAwardRepository;

	@Inject
	ActorLanguageRepository actorLanguageRepository;

	@Inject
	DirectorSpecializationRepository specializationRepository;

	@Inject
	ValidationService validationService;

	@Inject
	CastingService castingService;

	// Schauspieler

	public Actor getActor(Integer actorId) {
		return actorRepository.findById(actorId).orElseThrow(() -> RecordNotFoundException.of("Actor", actorId));
	}

	public List<Actor> listActors() {
		return actorRepository.listAll();
	}

	/**
	 * Legt einen Schauspieler an. Die Altersgrenze gilt nur beim Anlegen.
	 */
	@Transactional
	public Actor createActor(Actor actor) {
		validationService.validateActorInsert(actor);
		actorRepository.persist(actor);
		LOG.infof("Created actor %d %s", actor.getId(), actor.getFullName());
		return actor;
	}

	@Transactional
	public Actor updateActor(Integer actorId, Actor changes) {
		Actor actor = getActor(actorId);
		actor.setFirstName(changes.getFirstName());
		actor.setLastName(changes.getLastName());
		actor.setDateOfBirth(changes.getDateOfBirth());
		actor.setGender(changes.getGender());
		actor.setNationality(changes.getNationality());
		actor.setStageName(changes.getStageName());
		return actor;
	}

	@Transactional
	public void deleteActor(Integer actorId) {
		Actor actor = getActor(actorId);
		castingService.removeRolesForActor(actorId);
		actorLanguageRepository.deleteByActorId(actorId);
		actorAwardRepository.deleteByRecipientId(actorId);
		actorRepository.delete(actor);
		LOG.infof("Deleted actor %d", actorId);
	}

	// Regisseure

	public Director getDirector(Integer directorId) {
		return directorRepository.findById(directorId)
				.orElseThrow(() -> RecordNotFoundException.of("Director", directorId));
	}

	public List<Director> listDirectors() {
		return directorRepository.listAll();
	}

	@Transactional
	public Director createDirector(Director director) {
		directorRepository.persist(director);
		return director;
	}

	@Transactional
	public Director updateDirector(Integer directorId, Director changes) {
		Director director = getDirector(directorId);
		director.setName(changes.getName());
		director.setDateOfBirth(changes.getDateOfBirth());
		director.setGender(changes.getGender());
		director.setNationality(changes.getNationality());
		return director;
	}

	/**
	 * Löscht einen Regisseur; seine Filme bleiben ohne Regisseur erhalten.
	 */
	@Transactional
	public void deleteDirector(Integer directorId) {
		Director director = getDirector(directorId);
		int films = filmRepository.clearDirector(directorId);
		specializationRepository.deleteByDirectorId(directorId);
		directorAwardRepository.deleteByRecipientId(directorId);
		directorRepository.delete(director);
		LOG.infof("Deleted director %d, %d films unassigned", directorId, films);
	}

	// Produzenten

	public Producer getProducer(Integer producerId) {
		return producerRepository.findById(producerId)
				.orElseThrow(() -> RecordNotFoundException.of("Producer", producerId));
	}

	public List<Producer> listProducers() {
		return producerRepository.listAll();
	}

	@Transactional
	public Producer createProducer(Producer producer) {
		producerRepository.persist(producer);
		return producer;
	}

	@Transactional
	public Producer updateProducer(Integer producerId, Producer changes) {
		Producer producer = getProducer(producerId);
		producer.setName(changes.getName());
		producer.setCompany(changes.getCompany());
		producer.setContact(changes.getContact());
		producer.setEmail(changes.getEmail());
		producer.setDateOfBirth(changes.getDateOfBirth());
		return producer;
	}

	@Transactional
	public void deleteProducer(Integer producerId) {
		Producer producer = getProducer(producerId);
		producedByRepository.deleteByProducerId(producerId);
		producerRepository.delete(producer);
	}

	// Crew

	public Crew getCrew(Integer crewId) {
		return crewRepository.findById(crewId).orElseThrow(() -> RecordNotFoundException.of("Crew", crewId));
	}

	public List<Crew> listCrew() {
		return crewRepository.listAll();
	}

	public List<Crew> subordinatesOf(Integer crewId) {
		return crewRepository.findBySupervisorId(crewId);
	}

	@Transactional
	public Crew createCrew(Crew crew) {
		validationService.validateCrew(crew);
		requireSupervisor(crew.getSupervisorId());
		crewRepository.persist(crew);
		LOG.infof("Created crew member %d %s (%s)", crew.getId(), crew.getName(), crew.getJobTitle());
		return crew;
	}

	/**
	 * Aktualisiert ein Crew-Mitglied. Ein Vorgesetzter muss existieren und darf nicht das Mitglied selbst sein;
	 * längere Zyklen werden nicht geprüft.
	 */
	@Transactional
	public Crew updateCrew(Integer crewId, Crew changes) {
		Crew crew = getCrew(crewId);
		changes.setId(crewId);
		validationService.validateCrew(changes);
		requireSupervisor(changes.getSupervisorId());
		crew.setName(changes.getName());
		crew.setJobTitle(changes.getJobTitle());
		crew.setDateOfBirth(changes.getDateOfBirth());
		crew.setExperienceYears(changes.getExperienceYears());
		crew.setDepartment(changes.getDepartment());
		crew.setSupervisorId(changes.getSupervisorId());
		return crew;
	}

	/**
	 * Löscht ein Crew-Mitglied samt Einsätzen, Drehprotokollen, Equipment-Zuordnungen und Auszeichnungen; Untergebene verlieren ihren Vorgesetzten.
	 */
	@Transactional
	public void deleteCrew(Integer crewId) {
		Crew crew = getCrew(crewId);
		int subordinates = crewRepository.clearSupervisor(crewId);
		worksOnRepository.deleteByCrewId(crewId);
		sceneFilmingRepository.deleteByCrewId(crewId);
		crewEquipmentRepository.deleteByCrewId(crewId);
		crewAwardRepository.deleteByRecipientId(crewId);
		crewRepository.delete(crew);
		LOG.infof("Deleted crew member %d, %d subordinates unassigned", crewId, subordinates);
	}

	// Sprachen und Spezialisierungen

	public List<ActorLanguage> languagesOf(Integer actorId) {
		return actorLanguageRepository.findByActorId(actorId);
	}

	@Transactional
	public ActorLanguage addLanguage(Integer actorId, ActorLanguage language) {
		getActor(actorId);
		language.setLanguage(requireText(language.getLanguage(), "Language"));
		if (actorLanguageRepository.findByActorIdAndLanguage(actorId, language.getLanguage()).isPresent())
			throw new ConflictException("Actor " + actorId + " already speaks " + language.getLanguage());
		language.setActorId(actorId);
		actorLanguageRepository.persist(language);
		return language;
	}

	@Transactional
	public void removeLanguage(Integer actorId, String language) {
		ActorLanguage entry = actorLanguageRepository.findByActorIdAndLanguage(actorId, language)
				.orElseThrow(() -> new RecordNotFoundException("Actor " + actorId + " has no language " + language));
		actorLanguageRepository.delete(entry);
	}

	public List<DirectorSpecialization> specializationsOf(Integer directorId) {
		return specializationRepository.findByDirectorId(directorId);
	}

	@Transactional
	public DirectorSpecialization addSpecialization(Integer directorId, DirectorSpecialization specialization) {
		getDirector(directorId);
		specialization.setSpecialization(requireText(specialization.getSpecialization(), "Specialization"));
		if (specialization.getYearsExperience() != null && specialization.getYearsExperience() < 0)
			throw new ValidationException("Years of experience cannot be negative");
		if (specializationRepository.findByDirectorIdAndSpecialization(directorId,
				specialization.getSpecialization()).isPresent())
			throw new ConflictException("Director " + directorId + " already has specialization "
					+ specialization.getSpecialization());
		specialization.setDirectorId(directorId);
		specializationRepository.persist(specialization);
		return specialization;
	}

	@Transactional
	public void removeSpecialization(Integer directorId, String specialization) {
		DirectorSpecialization entry = specializationRepository
				.findByDirectorIdAndSpecialization(directorId, specialization)
				.orElseThrow(() -> new RecordNotFoundException(
						"Director " + directorId + " has no specialization " + specialization));
		specializationRepository.delete(entry);
	}

	// Auszeichnungen

	public List<ActorAward> awardsOfActor(Integer actorId) {
		return actorAwardRepository.findByRecipientId(actorId);
	}

	public List<DirectorAward> awardsOfDirector(Integer directorId) {
		return directorAwardRepository.findByRecipientId(directorId);
	}

	public List<CrewAward> awardsOfCrew(Integer crewId) {
		return crewAwardRepository.findByRecipientId(crewId);
	}

	@Transactional
	public ActorAward addActorAward(Integer actorId, ActorAward award) {
		getActor(actorId);
		return addAward(actorAwardRepository, "Actor", actorId, award);
	}

	@Transactional
	public DirectorAward addDirectorAward(Integer directorId, DirectorAward award) {
		getDirector(directorId);
		return addAward(directorAwardRepository, "Director", directorId, award);
	}

	@Transactional
	public CrewAward addCrewAward(Integer crewId, CrewAward award) {
		getCrew(crewId);
		return addAward(crewAwardRepository, "Crew", crewId, award);
	}

	@Transactional
	public void removeActorAward(Integer awardId) {
		actorAwardRepository.delete(actorAwardRepository.findById(awardId)
				.orElseThrow(() -> RecordNotFoundException.of("ActorAward", awardId)));
	}

	@Transactional
	public void removeDirectorAward(Integer awardId) {
		directorAwardRepository.delete(directorAwardRepository.findById(awardId)
				.orElseThrow(() -> RecordNotFoundException.of("DirectorAward", awardId)));
	}

	@Transactional
	public void removeCrewAward(Integer awardId) {
		crewAwardRepository.delete(crewAwardRepository.findById(awardId)
				.orElseThrow(() -> RecordNotFoundException.of("CrewAward", awardId)));
	}

	/**
	 * Name und Jahr sind Pflicht; dieselbe Auszeichnung im selben Jahr gibt es je Person nur einmal.
	 */
	private static <T extends Award> T addAward(AwardRepository<T> repository, String entity, Integer recipientId,
			T award) {
		award.setAwardName(requireText(award.getAwardName(), "Award name"));
		if (award.getAwardYear() == null)
			throw new ValidationException("Award year is required");
		if (repository.exists(recipientId, award.getAwardName(), award.getAwardYear()))
			throw new ConflictException(entity + " " + recipientId + " already has award " + award.getAwardName()
					+ " (" + award.getAwardYear() + ")");
		award.setRecipientId(recipientId);
		repository.persist(award);
		LOG.infof("%s %d received %s (%d)", entity, recipientId, award.getAwardName(), award.getAwardYear());
		return award;
	}

	private static String requireText(String value, String field) {
		if (value == null || value.isBlank())
			throw new ValidationException(field + " is required");
		return value.trim();
	}

	private void requireSupervisor(Integer supervisorId) {
		if (supervisorId != null && !crewRepository.existsById(supervisorId))
			throw RecordNotFoundException.of("Crew supervisor", supervisorId);
	}
}
