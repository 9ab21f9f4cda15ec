package com.filmdb.service;

import java.time.Instant;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.filmdb.entity.EquipmentAudit;
import com.filmdb.entity.FilmAudit;
import com.filmdb.entity.RoleAudit;
import com.filmdb.entity.UserActivityLog;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.EquipmentAuditRepository;
import com.filmdb.repository.FilmAuditRepository;
import com.filmdb.repository.RoleAuditRepository;
import com.filmdb.repository.UserActivityLogRepository;

/**
 * Lesender Zugriff auf die Audit-Protokolle, neueste Einträge zuerst.
 * <p>
 * Jeder Filter ist optional; {@code null} bedeutet "nicht einschränken".
 */
@ApplicationScoped
public class AuditQueryService {

	@Inject
	RoleAuditRepository roleAuditRepository;

	@Inject
	EquipmentAuditRepository equipmentAuditRepository;

	@Inject
	FilmAuditRepository filmAuditRepository;

	@Inject
	UserActivityLogRepository userActivityLogRepository;

	public List<RoleAudit> roleAudits(Integer actorId, Integer filmId, Instant from, Instant to) {
		checkRange(from, to);
		return roleAuditRepository.find(actorId, filmId, from, to);
	}

	public List<EquipmentAudit> equipmentAudits(Integer equipmentId, Instant from, Instant to) {
		checkRange(from, to);
		return equipmentAuditRepository.find(equipmentId, from, to);
	}

	public List<FilmAudit> filmAudits(Integer filmId, Instant from, Instant to) {
		checkRange(from, to);
		return filmAuditRepository.find(filmId, from, to);
	}

	public List<UserActivityLog> userActivity(String username, Instant from, Instant to) {
		checkRange(from, to);
		return userActivityLogRepository.find(username, from, to);
	}

	private static void checkRange(Instant from, Instant to) {
		if (from != null && to != null && to.isBefore(from))
			throw new ValidationException("Parameter 'to' must not be before 'from'");
	}
}
