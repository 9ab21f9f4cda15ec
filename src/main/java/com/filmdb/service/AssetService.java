package com.filmdb.service;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import com.filmdb.entity.Availability;
import com.filmdb.entity.Distributor;
import com.filmdb.entity.Equipment;
import com.filmdb.entity.ShootingLocation;
import com.filmdb.entity.Studio;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.DistributesRepository;
import com.filmdb.repository.DistributorRepository;
import com.filmdb.repository.EquipmentRepository;
import com.filmdb.repository.EquipmentUsageRepository;
import com.filmdb.repository.FilmCrewEquipmentRepository;
import com.filmdb.repository.HostsRepository;
import com.filmdb.repository.SceneFilmingRepository;
import com.filmdb.repository.ShootingLocationRepository;
import com.filmdb.repository.ShotAtRepository;
import com.filmdb.repository.StudioRepository;

/**
 * Produktionsmittel: Equipment, Drehorte, Studios und Verleiher.
 * <p>
 * Verfügbarkeitswechsel von Equipment werden auditiert.
 */
@ApplicationScoped
public class AssetService {

	private static final Logger LOG = Logger.getLogger(AssetService.class);

	@Inject
	EquipmentRepository equipmentRepository;

	@Inject
	ShootingLocationRepository locationRepository;

	@Inject
	StudioRepository studioRepository;

	@Inject
	DistributorRepository distributorRepository;

	@Inject
	EquipmentUsageRepository equipmentUsageRepository;

	@Inject
	SceneFilmingRepository sceneFilmingRepository;

	@Inject
	ShotAtRepository shotAtRepository;

	@Inject
	HostsRepository hostsRepository;

	@Inject
	DistributesRepository distributesRepository;

	@Inject
	FilmCrewEquipmentRepository crewEquipmentRepository;

	@Inject
	ValidationService validationService;

	@Inject
	AuditService auditService;

	// Equipment

	public Equipment getEquipment(Integer equipmentId) {
		return equipmentRepository.findById(equipmentId)
				.orElseThrow(() -> RecordNotFoundException.of("Equipment", equipmentId));
	}

	public List<Equipment> listEquipment() {
		return equipmentRepository.listAll();
	}

	@Transactional
	public Equipment createEquipment(Equipment equipment) {
		validationService.validateEquipment(equipment);
		if (equipment.getAvailability() == null)
			equipment.setAvailability(Availability.AVAILABLE);
		equipmentRepository.persist(equipment);
		return equipment;
	}

	@Transactional
	public Equipment updateEquipment(Integer equipmentId, Equipment changes) {
		Equipment equipment = getEquipment(equipmentId);
		validationService.validateEquipment(changes);
		Availability oldAvailability = equipment.getAvailability();
		equipment.setName(changes.getName());
		equipment.setType(changes.getType());
		equipment.setCost(changes.getCost());
		equipment.setPurchaseDate(changes.getPurchaseDate());
		equipment.setCondition(changes.getCondition());
		if (changes.getAvailability() != null)
			equipment.setAvailability(changes.getAvailability());
		auditService.recordAvailabilityChange(equipment, oldAvailability);
		return equipment;
	}

	@Transactional
	public Equipment changeAvailability(Integer equipmentId, Availability availability) {
		if (availability == null)
			throw new ValidationException("Equipment availability is required");
		Equipment equipment = getEquipment(equipmentId);
		Availability oldAvailability = equipment.getAvailability();
		equipment.setAvailability(availability);
		auditService.recordAvailabilityChange(equipment, oldAvailability);
		LOG.infof("Equipment %d availability %s -> %s", equipmentId, oldAvailability, availability);
		return equipment;
	}

	/**
	 * Löscht Equipment; Nutzungen und Crew-Zuordnungen entfallen, Drehprotokolle behalten den Eintrag ohne Equipment.
	 */
	@Transactional
	public void deleteEquipment(Integer equipmentId) {
		Equipment equipment = getEquipment(equipmentId);
		equipmentUsageRepository.deleteByEquipmentId(equipmentId);
		crewEquipmentRepository.deleteByEquipmentId(equipmentId);
		sceneFilmingRepository.clearEquipment(equipmentId);
		equipmentRepository.delete(equipment);
	}

	// Drehorte

	public ShootingLocation getLocation(Integer locationId) {
		return locationRepository.findById(locationId)
				.orElseThrow(() -> RecordNotFoundException.of("ShootingLocation", locationId));
	}

	public List<ShootingLocation> listLocations() {
		return locationRepository.listAll();
	}

	@Transactional
	public ShootingLocation createLocation(ShootingLocation location) {
		validationService.validateShootingLocation(location);
		locationRepository.persist(location);
		LOG.infof("Created location %d %s, %s", location.getId(), location.getName(), location.getCity());
		return location;
	}

	@Transactional
	public ShootingLocation updateLocation(Integer locationId, ShootingLocation changes) {
		ShootingLocation location = getLocation(locationId);
		validationService.validateShootingLocation(changes);
		location.setName(changes.getName());
		location.setCity(changes.getCity());
		location.setState(changes.getState());
		location.setCountry(changes.getCountry());
		location.setCostPerDay(changes.getCostPerDay());
		location.setArea(changes.getArea());
		location.setAmenities(changes.getAmenities());
		return location;
	}

	@Transactional
	public void deleteLocation(Integer locationId) {
		ShootingLocation location = getLocation(locationId);
		shotAtRepository.deleteByLocationId(locationId);
		locationRepository.delete(location);
	}

	// Studios

	public Studio getStudio(Integer studioId) {
		return studioRepository.findById(studioId).orElseThrow(() -> RecordNotFoundException.of("Studio", studioId));
	}

	public List<Studio> listStudios() {
		return studioRepository.listAll();
	}

	@Transactional
	public Studio createStudio(Studio studio) {
		checkCapacity(studio);
		studioRepository.persist(studio);
		return studio;
	}

	@Transactional
	public Studio updateStudio(Integer studioId, Studio changes) {
		Studio studio = getStudio(studioId);
		checkCapacity(changes);
		studio.setName(changes.getName());
		studio.setLocation(changes.getLocation());
		studio.setEstablishedYear(changes.getEstablishedYear());
		studio.setCapacity(changes.getCapacity());
		studio.setFacilities(changes.getFacilities());
		return studio;
	}

	@Transactional
	public void deleteStudio(Integer studioId) {
		Studio studio = getStudio(studioId);
		hostsRepository.deleteByStudioId(studioId);
		studioRepository.delete(studio);
	}

	// Verleiher

	public Distributor getDistributor(Integer distributorId) {
		return distributorRepository.findById(distributorId)
				.orElseThrow(() -> RecordNotFoundException.of("Distributor", distributorId));
	}

	public List<Distributor> listDistributors() {
		return distributorRepository.listAll();
	}

	@Transactional
	public Distributor createDistributor(Distributor distributor) {
		validationService.validateDistributor(distributor);
		distributorRepository.persist(distributor);
		return distributor;
	}

	@Transactional
	public Distributor updateDistributor(Integer distributorId, Distributor changes) {
		Distributor distributor = getDistributor(distributorId);
		validationService.validateDistributor(changes);
		distributor.setName(changes.getName());
		distributor.setRegion(changes.getRegion());
		distributor.setMarketShare(changes.getMarketShare());
		return distributor;
	}

	@Transactional
	public void deleteDistributor(Integer distributorId) {
		Distributor distributor = getDistributor(distributorId);
		distributesRepository.deleteByDistributorId(distributorId);
		distributorRepository.delete(distributor);
	}

	private static void checkCapacity(Studio studio) {
		if (studio.getCapacity() != null && studio.getCapacity() < 0)
			throw new ValidationException("Studio capacity cannot be negative");
	}
}
