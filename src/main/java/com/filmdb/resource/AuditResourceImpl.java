package com.filmdb.resource;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;

import com.filmdb.entity.Capability;
import com.filmdb.entity.EquipmentAudit;
import com.filmdb.entity.FilmAudit;
import com.filmdb.entity.RoleAudit;
import com.filmdb.entity.UserActivityLog;
import com.filmdb.service.AccessControlService;
import com.filmdb.service.AuditQueryService;

/**
 * Implementierung der Audit-Abfragen. Zeitgrenzen werden als ISO-8601-Zeitpunkte übergeben.
 */
public class AuditResourceImpl implements AuditResource {

	@Inject
	AuditQueryService auditQueryService;

	@Inject
	AccessControlService accessControlService;

	@Override
	public List<RoleAudit> roleAudits(String caller, Integer actorId, Integer filmId, String from, String to) {
		accessControlService.requireCapability(caller, Capability.READ);
		return auditQueryService.roleAudits(actorId, filmId, parse("from", from), parse("to", to));
	}

	@Override
	public List<EquipmentAudit> equipmentAudits(String caller, Integer equipmentId, String from, String to) {
		accessControlService.requireCapability(caller, Capability.READ);
		return auditQueryService.equipmentAudits(equipmentId, parse("from", from), parse("to", to));
	}

	@Override
	public List<FilmAudit> filmAudits(String caller, Integer filmId, String from, String to) {
		accessControlService.requireCapability(caller, Capability.READ);
		return auditQueryService.filmAudits(filmId, parse("from", from), parse("to", to));
	}

	@Override
	public List<UserActivityLog> userActivity(String caller, String username, String from, String to) {
		accessControlService.requireCapability(caller, Capability.ADMINISTER);
		return auditQueryService.userActivity(username, parse("from", from), parse("to", to));
	}

	/**
	 * Wandelt einen optionalen ISO-8601-Zeitpunkt um.
	 */
	static Instant parse(String parameter, String value) {
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			return Instant.parse(value);
		} catch (DateTimeParseException e) {
			throw new BadRequestException("Parameter '" + parameter + "' must be an ISO-8601 instant", e);
		}
	}
}
