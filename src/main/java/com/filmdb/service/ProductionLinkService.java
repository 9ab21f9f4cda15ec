package com.filmdb.service;

import java.math.BigDecimal;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import com.filmdb.entity.Distributes;
import com.filmdb.entity.EquipmentUsage;
import com.filmdb.entity.FilmCrewEquipment;
import com.filmdb.entity.Hosts;
import com.filmdb.entity.ProducedBy;
import com.filmdb.entity.SceneFilming;
import com.filmdb.entity.ShotAt;
import com.filmdb.entity.WorksOn;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.BaseRepository;
import com.filmdb.repository.CrewRepository;
import com.filmdb.repository.DistributesRepository;
import com.filmdb.repository.DistributorRepository;
import com.filmdb.repository.EquipmentRepository;
import com.filmdb.repository.EquipmentUsageRepository;
import com.filmdb.repository.FilmCrewEquipmentRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.HostsRepository;
import com.filmdb.repository.ProducedByRepository;
import com.filmdb.repository.ProducerRepository;
import com.filmdb.repository.SceneFilmingRepository;
import com.filmdb.repository.SceneRepository;
import com.filmdb.repository.ShootingLocationRepository;
import com.filmdb.repository.ShotAtRepository;
import com.filmdb.repository.StudioRepository;
import com.filmdb.repository.WorksOnRepository;

/**
 * Verknüpfungen eines Films mit Produzenten, Verleihern, Studios, Crew, Drehorten und Equipment.
 * <p>
 * Beide Enden einer Verknüpfung müssen existieren, jedes Paar darf nur einmal vorkommen.
 */
@ApplicationScoped
public class ProductionLinkService {

	private static final Logger LOG = Logger.getLogger(ProductionLinkService.class);

	private static final BigDecimal MAX_EFFICIENCY = BigDecimal.TEN;

	@Inject
	FilmRepository filmRepository;

	@Inject
	ProducerRepository producerRepository;

	@Inject
	DistributorRepository distributorRepository;

	@Inject
	StudioRepository studioRepository;

	@Inject
	CrewRepository crewRepository;

	@Inject
	ShootingLocationRepository locationRepository;

	@Inject
	EquipmentRepository equipmentRepository;

	@Inject
	SceneRepository sceneRepository;

	@Inject
	ProducedByRepository producedByRepository;

	@Inject
	DistributesRepository distributesRepository;

	@Inject
	HostsRepository hostsRepository;

	@Inject
	WorksOnRepository worksOnRepository;

	@Inject
	ShotAtRepository shotAtRepository;

	@Inject
	EquipmentUsageRepository equipmentUsageRepository;

	@Inject
	SceneFilmingRepository sceneFilmingRepository;

	@Inject
	FilmCrewEquipmentRepository crewEquipmentRepository;

	@Inject
	ValidationService validationService;

	@Transactional
	public ProducedBy addProducer(ProducedBy producedBy) {
		requireFilm(producedBy.getFilmId());
		if (!producerRepository.existsById(producedBy.getProducerId()))
			throw RecordNotFoundException.of("Producer", producedBy.getProducerId());
		if (producedByRepository.existsByFilmAndProducer(producedBy.getFilmId(), producedBy.getProducerId()))
			throw duplicate("Producer", producedBy.getProducerId(), producedBy.getFilmId());
		producedByRepository.persist(producedBy);
		return producedBy;
	}

	@Transactional
	public Distributes addDistribution(Distributes distributes) {
		requireFilm(distributes.getFilmId());
		if (!distributorRepository.existsById(distributes.getDistributorId()))
			throw RecordNotFoundException.of("Distributor", distributes.getDistributorId());
		if (distributesRepository.existsByDistributorAndFilm(distributes.getDistributorId(),
				distributes.getFilmId()))
			throw duplicate("Distributor", distributes.getDistributorId(), distributes.getFilmId());
		distributesRepository.persist(distributes);
		return distributes;
	}

	@Transactional
	public Hosts addStudioRental(Hosts hosts) {
		requireFilm(hosts.getFilmId());
		if (!studioRepository.existsById(hosts.getStudioId()))
			throw RecordNotFoundException.of("Studio", hosts.getStudioId());
		if (hostsRepository.existsByStudioAndFilm(hosts.getStudioId(), hosts.getFilmId()))
			throw duplicate("Studio", hosts.getStudioId(), hosts.getFilmId());
		hostsRepository.persist(hosts);
		return hosts;
	}

	@Transactional
	public WorksOn assignCrew(WorksOn worksOn) {
		if (!crewRepository.existsById(worksOn.getCrewId()))
			throw RecordNotFoundException.of("Crew", worksOn.getCrewId());
		requireFilm(worksOn.getFilmId());
		if (worksOnRepository.existsByCrewAndFilm(worksOn.getCrewId(), worksOn.getFilmId()))
			throw duplicate("Crew", worksOn.getCrewId(), worksOn.getFilmId());
		worksOnRepository.persist(worksOn);
		LOG.infof("Crew %d assigned to film %d (%s)", worksOn.getCrewId(), worksOn.getFilmId(),
				worksOn.getDepartment());
		return worksOn;
	}

	/**
	 * Bucht einen Drehort für einen Film. Das Datumsintervall wird vor allen anderen Prüfungen geprüft.
	 */
	@Transactional
	public ShotAt bookLocation(ShotAt shotAt) {
		validationService.validateShotAt(shotAt);
		requireFilm(shotAt.getFilmId());
		if (!locationRepository.existsById(shotAt.getLocationId()))
			throw RecordNotFoundException.of("ShootingLocation", shotAt.getLocationId());
		if (shotAtRepository.existsByFilmAndLocation(shotAt.getFilmId(), shotAt.getLocationId()))
			throw duplicate("Location", shotAt.getLocationId(), shotAt.getFilmId());
		shotAtRepository.persist(shotAt);
		return shotAt;
	}

	@Transactional
	public EquipmentUsage recordEquipmentUsage(EquipmentUsage usage) {
		requireFilm(usage.getFilmId());
		if (!equipmentRepository.existsById(usage.getEquipmentId()))
			throw RecordNotFoundException.of("Equipment", usage.getEquipmentId());
		if (equipmentUsageRepository.existsByFilmAndEquipment(usage.getFilmId(), usage.getEquipmentId()))
			throw duplicate("Equipment", usage.getEquipmentId(), usage.getFilmId());
		equipmentUsageRepository.persist(usage);
		return usage;
	}

	/**
	 * Protokolliert einen Drehtermin. Die Szene muss zum Film gehören, Equipment ist optional.
	 */
	@Transactional
	public SceneFilming recordSceneFilming(SceneFilming filming) {
		requireFilm(filming.getFilmId());
		Integer sceneFilmId = sceneRepository.findById(filming.getSceneId())
				.orElseThrow(() -> RecordNotFoundException.of("Scene", filming.getSceneId()))
				.getFilmId();
		if (!filming.getFilmId().equals(sceneFilmId))
			throw new ValidationException("Scene " + filming.getSceneId() + " does not belong to film "
					+ filming.getFilmId());
		if (!crewRepository.existsById(filming.getCrewId()))
			throw RecordNotFoundException.of("Crew", filming.getCrewId());
		if (filming.getEquipmentId() != null && !equipmentRepository.existsById(filming.getEquipmentId()))
			throw RecordNotFoundException.of("Equipment", filming.getEquipmentId());
		if (filming.getDurationMinutes() != null && filming.getDurationMinutes() < 0)
			throw new ValidationException("Filming duration cannot be negative");
		sceneFilmingRepository.persist(filming);
		return filming;
	}

	/**
	 * Ordnet einem Crew-Mitglied Equipment für einen Film zu. Film, Crew und Equipment müssen existieren, die
	 * Kombination darf nur einmal vorkommen.
	 */
	@Transactional
	public FilmCrewEquipment assignCrewEquipment(FilmCrewEquipment assignment) {
		checkCrewEquipment(assignment);
		requireFilm(assignment.getFilmId());
		if (!crewRepository.existsById(assignment.getCrewId()))
			throw RecordNotFoundException.of("Crew", assignment.getCrewId());
		if (!equipmentRepository.existsById(assignment.getEquipmentId()))
			throw RecordNotFoundException.of("Equipment", assignment.getEquipmentId());
		if (crewEquipmentRepository.existsByFilmCrewAndEquipment(assignment.getFilmId(), assignment.getCrewId(),
				assignment.getEquipmentId()))
			throw new ConflictException("Equipment " + assignment.getEquipmentId() + " is already assigned to crew "
					+ assignment.getCrewId() + " in film " + assignment.getFilmId());
		crewEquipmentRepository.persist(assignment);
		return assignment;
	}

	// Änderung und Einzellöschung; Film und Gegenstück einer Verknüpfung bleiben fest

	@Transactional
	public ProducedBy updateProducer(Integer linkId, ProducedBy changes) {
		ProducedBy producedBy = require(producedByRepository, "ProducedBy", linkId);
		producedBy.setInvestment(changes.getInvestment());
		return producedBy;
	}

	@Transactional
	public void removeProducer(Integer linkId) {
		producedByRepository.delete(require(producedByRepository, "ProducedBy", linkId));
		LOG.debugf("Removed producer link %d", linkId);
	}

	@Transactional
	public Distributes updateDistribution(Integer linkId, Distributes changes) {
		Distributes distributes = require(distributesRepository, "Distributes", linkId);
		distributes.setDistributionFee(changes.getDistributionFee());
		distributes.setDistributionDate(changes.getDistributionDate());
		distributes.setTerritory(changes.getTerritory());
		return distributes;
	}

	@Transactional
	public void removeDistribution(Integer linkId) {
		distributesRepository.delete(require(distributesRepository, "Distributes", linkId));
		LOG.debugf("Removed distribution %d", linkId);
	}

	@Transactional
	public Hosts updateStudioRental(Integer linkId, Hosts changes) {
		Hosts hosts = require(hostsRepository, "Hosts", linkId);
		hosts.setRentalCost(changes.getRentalCost());
		hosts.setRentalStart(changes.getRentalStart());
		hosts.setRentalEnd(changes.getRentalEnd());
		return hosts;
	}

	@Transactional
	public void removeStudioRental(Integer linkId) {
		hostsRepository.delete(require(hostsRepository, "Hosts", linkId));
		LOG.debugf("Removed studio rental %d", linkId);
	}

	@Transactional
	public WorksOn updateCrewAssignment(Integer linkId, WorksOn changes) {
		WorksOn worksOn = require(worksOnRepository, "WorksOn", linkId);
		worksOn.setStartDate(changes.getStartDate());
		worksOn.setEndDate(changes.getEndDate());
		if (changes.getDepartment() != null)
			worksOn.setDepartment(changes.getDepartment());
		return worksOn;
	}

	@Transactional
	public void removeCrewAssignment(Integer linkId) {
		worksOnRepository.delete(require(worksOnRepository, "WorksOn", linkId));
		LOG.debugf("Removed crew assignment %d", linkId);
	}

	/**
	 * Verschiebt eine Drehortbuchung. Es gilt dieselbe Datumsprüfung wie beim Buchen.
	 */
	@Transactional
	public ShotAt updateLocationBooking(Integer linkId, ShotAt changes) {
		ShotAt shotAt = require(shotAtRepository, "ShotAt", linkId);
		validationService.validateShotAt(changes);
		shotAt.setShootingStart(changes.getShootingStart());
		shotAt.setShootingEnd(changes.getShootingEnd());
		if (changes.getTotalCost() != null)
			shotAt.setTotalCost(changes.getTotalCost());
		return shotAt;
	}

	@Transactional
	public void removeLocationBooking(Integer linkId) {
		shotAtRepository.delete(require(shotAtRepository, "ShotAt", linkId));
		LOG.debugf("Removed location booking %d", linkId);
	}

	@Transactional
	public EquipmentUsage updateEquipmentUsage(Integer linkId, EquipmentUsage changes) {
		EquipmentUsage usage = require(equipmentUsageRepository, "EquipmentUsage", linkId);
		usage.setUsageStart(changes.getUsageStart());
		usage.setUsageEnd(changes.getUsageEnd());
		return usage;
	}

	@Transactional
	public void removeEquipmentUsage(Integer linkId) {
		equipmentUsageRepository.delete(require(equipmentUsageRepository, "EquipmentUsage", linkId));
		LOG.debugf("Removed equipment usage %d", linkId);
	}

	/**
	 * Ändert Datum, Dauer, Notizen und Equipment eines Drehprotokolls. Szene, Crew und Film bleiben fest.
	 */
	@Transactional
	public SceneFilming updateSceneFilming(Integer filmingId, SceneFilming changes) {
		SceneFilming filming = require(sceneFilmingRepository, "SceneFilming", filmingId);
		if (changes.getEquipmentId() != null && !equipmentRepository.existsById(changes.getEquipmentId()))
			throw RecordNotFoundException.of("Equipment", changes.getEquipmentId());
		if (changes.getDurationMinutes() != null && changes.getDurationMinutes() < 0)
			throw new ValidationException("Filming duration cannot be negative");
		filming.setEquipmentId(changes.getEquipmentId());
		filming.setFilmingDate(changes.getFilmingDate());
		filming.setDurationMinutes(changes.getDurationMinutes());
		filming.setNotes(changes.getNotes());
		return filming;
	}

	@Transactional
	public void removeSceneFilming(Integer filmingId) {
		sceneFilmingRepository.delete(require(sceneFilmingRepository, "SceneFilming", filmingId));
		LOG.debugf("Removed scene filming %d", filmingId);
	}

	@Transactional
	public FilmCrewEquipment updateCrewEquipment(Integer linkId, FilmCrewEquipment changes) {
		FilmCrewEquipment assignment = require(crewEquipmentRepository, "FilmCrewEquipment", linkId);
		checkCrewEquipment(changes);
		assignment.setDaysUsed(changes.getDaysUsed());
		assignment.setEfficiencyRating(changes.getEfficiencyRating());
		assignment.setMaintenanceRequired(changes.isMaintenanceRequired());
		return assignment;
	}

	@Transactional
	public void removeCrewEquipment(Integer linkId) {
		crewEquipmentRepository.delete(require(crewEquipmentRepository, "FilmCrewEquipment", linkId));
		LOG.debugf("Removed crew equipment %d", linkId);
	}

	public List<ProducedBy> producersOf(Integer filmId) {
		return producedByRepository.findByFilmId(filmId);
	}

	public List<Distributes> distributionsOf(Integer filmId) {
		return distributesRepository.findByFilmId(filmId);
	}

	public List<Hosts> studioRentalsOf(Integer filmId) {
		return hostsRepository.findByFilmId(filmId);
	}

	public List<WorksOn> crewOf(Integer filmId) {
		return worksOnRepository.findByFilmId(filmId);
	}

	public List<ShotAt> locationsOf(Integer filmId) {
		return shotAtRepository.findByFilmId(filmId);
	}

	public List<EquipmentUsage> equipmentOf(Integer filmId) {
		return equipmentUsageRepository.findByFilmId(filmId);
	}

	public List<SceneFilming> filmingsOf(Integer filmId) {
		return sceneFilmingRepository.findByFilmId(filmId);
	}

	public List<FilmCrewEquipment> crewEquipmentOf(Integer filmId) {
		return crewEquipmentRepository.findByFilmId(filmId);
	}

	/**
	 * Entfernt alle Verknüpfungen eines Films vor dessen Löschung.
	 */
	@Transactional
	public void deleteLinksForFilm(Integer filmId) {
		int removed = sceneFilmingRepository.deleteByFilmId(filmId)
				+ producedByRepository.deleteByFilmId(filmId)
				+ distributesRepository.deleteByFilmId(filmId)
				+ hostsRepository.deleteByFilmId(filmId)
				+ worksOnRepository.deleteByFilmId(filmId)
				+ shotAtRepository.deleteByFilmId(filmId)
				+ equipmentUsageRepository.deleteByFilmId(filmId)
				+ crewEquipmentRepository.deleteByFilmId(filmId);
		LOG.debugf("Removed %d links of film %d", removed, filmId);
	}

	private static void checkCrewEquipment(FilmCrewEquipment assignment) {
		if (assignment.getDaysUsed() != null && assignment.getDaysUsed() < 0)
			throw new ValidationException("Days used cannot be negative");
		BigDecimal rating = assignment.getEfficiencyRating();
		if (rating != null && (rating.signum() < 0 || rating.compareTo(MAX_EFFICIENCY) > 0))
			throw new ValidationException("Efficiency rating must be between 0 and 10");
	}

	private void requireFilm(Integer filmId) {
		if (!filmRepository.existsById(filmId))
			throw RecordNotFoundException.of("Film", filmId);
	}

	private static <T> T require(BaseRepository<T, Integer> repository, String entity, Integer id) {
		return repository.findById(id).orElseThrow(() -> RecordNotFoundException.of(entity, id));
	}

	private static ConflictException duplicate(String entity, Integer id, Integer filmId) {
		return new ConflictException(entity + " " + id + " is already linked to film " + filmId);
	}
}
