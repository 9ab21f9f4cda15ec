package com.filmdb.resource;

import java.util.List;

import jakarta.inject.Inject;

import com.filmdb.entity.Capability;
import com.filmdb.entity.Distributes;
import com.filmdb.entity.EquipmentUsage;
import com.filmdb.entity.FilmCrewEquipment;
import com.filmdb.entity.Hosts;
import com.filmdb.entity.ProducedBy;
import com.filmdb.entity.SceneFilming;
import com.filmdb.entity.ShotAt;
import com.filmdb.entity.WorksOn;
import com.filmdb.service.AccessControlService;
import com.filmdb.service.ProductionLinkService;

/**
 * Implementierung der Verknüpfungs-Endpunkte. Die Film-ID kommt immer aus dem Pfad.
 */
public class ProductionLinkResourceImpl implements ProductionLinkResource {

	@Inject
	ProductionLinkService productionLinkService;

	@Inject
	AccessControlService accessControlService;

	@Override
	public List<ProducedBy> listProducers(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.producersOf(filmId);
	}

	@Override
	public ProducedBy addProducer(String caller, int filmId, ProducedBy producedBy) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		producedBy.setId(null);
		producedBy.setFilmId(filmId);
		return productionLinkService.addProducer(producedBy);
	}

	@Override
	public ProducedBy updateProducer(String caller, int linkId, ProducedBy producedBy) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateProducer(linkId, producedBy);
	}

	@Override
	public void removeProducer(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeProducer(linkId);
	}

	@Override
	public List<Distributes> listDistributions(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.distributionsOf(filmId);
	}

	@Override
	public Distributes addDistribution(String caller, int filmId, Distributes distributes) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		distributes.setId(null);
		distributes.setFilmId(filmId);
		return productionLinkService.addDistribution(distributes);
	}

	@Override
	public Distributes updateDistribution(String caller, int linkId, Distributes distributes) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateDistribution(linkId, distributes);
	}

	@Override
	public void removeDistribution(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeDistribution(linkId);
	}

	@Override
	public List<Hosts> listStudioRentals(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.studioRentalsOf(filmId);
	}

	@Override
	public Hosts addStudioRental(String caller, int filmId, Hosts hosts) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		hosts.setId(null);
		hosts.setFilmId(filmId);
		return productionLinkService.addStudioRental(hosts);
	}

	@Override
	public Hosts updateStudioRental(String caller, int linkId, Hosts hosts) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateStudioRental(linkId, hosts);
	}

	@Override
	public void removeStudioRental(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeStudioRental(linkId);
	}

	@Override
	public List<WorksOn> listCrewAssignments(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.crewOf(filmId);
	}

	@Override
	public WorksOn addCrewAssignment(String caller, int filmId, WorksOn worksOn) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		worksOn.setId(null);
		worksOn.setFilmId(filmId);
		return productionLinkService.assignCrew(worksOn);
	}

	@Override
	public WorksOn updateCrewAssignment(String caller, int linkId, WorksOn worksOn) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateCrewAssignment(linkId, worksOn);
	}

	@Override
	public void removeCrewAssignment(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeCrewAssignment(linkId);
	}

	@Override
	public List<ShotAt> listLocationBookings(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.locationsOf(filmId);
	}

	@Override
	public ShotAt addLocationBooking(String caller, int filmId, ShotAt shotAt) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		shotAt.setId(null);
		shotAt.setFilmId(filmId);
		return productionLinkService.bookLocation(shotAt);
	}

	@Override
	public ShotAt updateLocationBooking(String caller, int linkId, ShotAt shotAt) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateLocationBooking(linkId, shotAt);
	}

	@Override
	public void removeLocationBooking(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeLocationBooking(linkId);
	}

	@Override
	public List<EquipmentUsage> listEquipmentUsages(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.equipmentOf(filmId);
	}

	@Override
	public EquipmentUsage addEquipmentUsage(String caller, int filmId, EquipmentUsage equipmentUsage) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		equipmentUsage.setId(null);
		equipmentUsage.setFilmId(filmId);
		return productionLinkService.recordEquipmentUsage(equipmentUsage);
	}

	@Override
	public EquipmentUsage updateEquipmentUsage(String caller, int linkId, EquipmentUsage equipmentUsage) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateEquipmentUsage(linkId, equipmentUsage);
	}

	@Override
	public void removeEquipmentUsage(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeEquipmentUsage(linkId);
	}

	@Override
	public List<FilmCrewEquipment> listCrewEquipment(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.crewEquipmentOf(filmId);
	}

	@Override
	public FilmCrewEquipment addCrewEquipment(String caller, int filmId, FilmCrewEquipment assignment) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		assignment.setId(null);
		assignment.setFilmId(filmId);
		return productionLinkService.assignCrewEquipment(assignment);
	}

	@Override
	public FilmCrewEquipment updateCrewEquipment(String caller, int linkId, FilmCrewEquipment assignment) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateCrewEquipment(linkId, assignment);
	}

	@Override
	public void removeCrewEquipment(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeCrewEquipment(linkId);
	}

	@Override
	public List<SceneFilming> listSceneFilmings(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return productionLinkService.filmingsOf(filmId);
	}

	@Override
	public SceneFilming addSceneFilming(String caller, int filmId, SceneFilming sceneFilming) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		sceneFilming.setId(null);
		sceneFilming.setFilmId(filmId);
		return productionLinkService.recordSceneFilming(sceneFilming);
	}

	@Override
	public SceneFilming updateSceneFilming(String caller, int linkId, SceneFilming sceneFilming) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return productionLinkService.updateSceneFilming(linkId, sceneFilming);
	}

	@Override
	public void removeSceneFilming(String caller, int linkId) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		productionLinkService.removeSceneFilming(linkId);
	}
}
