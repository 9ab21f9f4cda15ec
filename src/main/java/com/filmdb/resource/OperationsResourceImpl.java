package com.filmdb.resource;

import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;

import com.filmdb.entity.Availability;
import com.filmdb.entity.Capability;
import com.filmdb.entity.Film;
import com.filmdb.entity.ProductionStatus;
import com.filmdb.entity.Role;
import com.filmdb.entity.WorksOn;
import com.filmdb.entity.dto.CastActorRequestDTO;
import com.filmdb.entity.dto.CrewAllocationRequestDTO;
import com.filmdb.entity.dto.FilmWithGenresRequestDTO;
import com.filmdb.entity.dto.LoginRequestDTO;
import com.filmdb.entity.dto.OperationResultDTO;
import com.filmdb.entity.dto.ShootingLocationRequestDTO;
import com.filmdb.entity.dto.ShootingLocationResultDTO;
import com.filmdb.service.AccessControlService;
import com.filmdb.service.ProductionOperationsService;

import io.micrometer.core.annotation.Timed;

/**
 * Implementierung der Operations-Endpunkte. Alle Operationen schreiben und verlangen WRITE.
 */
public class OperationsResourceImpl implements OperationsResource {

	@Inject
	ProductionOperationsService operationsService;

	@Inject
	AccessControlService accessControlService;

	@Override
	@Timed(value = "filmdb.http.operations.cast", description = "Laufzeit der Rollenbesetzung")
	public Role castActor(String caller, CastActorRequestDTO request) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return operationsService.castActorInFilm(request.getActorId(), request.getFilmId(),
				request.getCharacterName(), request.getImportance(), request.getSalary());
	}

	@Override
	@Timed(value = "filmdb.http.operations.crew-allocation", description = "Laufzeit der Crew-Zuteilung")
	public WorksOn allocateCrew(String caller, CrewAllocationRequestDTO request) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return operationsService.allocateCrewToFilm(request.getCrewId(), request.getFilmId(),
				request.getStartDate(), request.getEndDate());
	}

	@Override
	@Timed(value = "filmdb.http.operations.shooting-location", description = "Laufzeit der Drehortbuchung")
	public ShootingLocationResultDTO addShootingLocation(String caller, ShootingLocationRequestDTO request) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return operationsService.addShootingLocation(request.getFilmId(), request.getName(), request.getCity(),
				request.getCountry(), request.getShootingStart(), request.getShootingEnd(), request.getCostPerDay());
	}

	@Override
	@Timed(value = "filmdb.http.operations.film-status", description = "Laufzeit der Statusänderung eines Films")
	public OperationResultDTO updateProductionStatus(String caller, int filmId, ProductionStatus status) {
		if (status == null) {
			throw new BadRequestException("Parameter 'status' is required");
		}
		accessControlService.requireCapability(caller, Capability.WRITE);
		return operationsService.updateProductionStatus(filmId, status);
	}

	@Override
	public OperationResultDTO updateEquipmentStatus(String caller, int equipmentId, Availability availability) {
		if (availability == null) {
			throw new BadRequestException("Parameter 'availability' is required");
		}
		accessControlService.requireCapability(caller, Capability.WRITE);
		return operationsService.updateEquipmentStatus(equipmentId, availability);
	}

	@Override
	public Film addFilmWithGenres(String caller, FilmWithGenresRequestDTO request) {
		accessControlService.requireCapability(caller, Capability.WRITE);
		return operationsService.addFilmWithGenres(request.getTitle(), request.getBudget(), request.getDuration(),
				request.getDirectorId(), request.getLanguage(), request.getGenres());
	}

	@Override
	public void recordLogin(LoginRequestDTO request) {
		if (request.getUsername() == null || request.getUsername().isBlank()) {
			throw new BadRequestException("Field 'username' is required");
		}
		operationsService.updateLogin(request.getUsername(), request.isSuccess(), request.getIpAddress());
	}
}
