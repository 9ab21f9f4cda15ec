package com.filmdb.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import com.filmdb.entity.AuditAction;
import com.filmdb.entity.Availability;
import com.filmdb.entity.Equipment;
import com.filmdb.entity.EquipmentAudit;
import com.filmdb.entity.Film;
import com.filmdb.entity.FilmAudit;
import com.filmdb.entity.ProductionStatus;
import com.filmdb.entity.Role;
import com.filmdb.entity.RoleAudit;
import com.filmdb.entity.UserActivityLog;
import com.filmdb.entity.UserActivityType;
import com.filmdb.repository.EquipmentAuditRepository;
import com.filmdb.repository.FilmAuditRepository;
import com.filmdb.repository.RoleAuditRepository;
import com.filmdb.repository.UserActivityLogRepository;

/**
 * Schreibt Audit-Einträge direkt nach einer erfolgreichen Änderung.
 * <p>
 * Alle Methoden laufen in der Transaktion des Aufrufers ({@link Transactional.TxType#MANDATORY}): Änderung und
 * Audit-Eintrag werden gemeinsam committet oder gemeinsam zurückgerollt.
 */
@ApplicationScoped
@Transactional(Transactional.TxType.MANDATORY)
public class AuditService {

	private static final Logger LOG = Logger.getLogger(AuditService.class);

	@Inject
	Clock clock;

	@Inject
	RoleAuditRepository roleAuditRepository;

	@Inject
	EquipmentAuditRepository equipmentAuditRepository;

	@Inject
	FilmAuditRepository filmAuditRepository;

	@Inject
	UserActivityLogRepository userActivityLogRepository;

	public RoleAudit recordRoleInsert(Role role) {
		return appendRoleAudit(role, AuditAction.INSERT);
	}

	public RoleAudit recordRoleDelete(Role role) {
		return appendRoleAudit(role, AuditAction.DELETE);
	}

	/**
	 * Protokolliert einen Verfügbarkeitswechsel; ohne tatsächliche Änderung wird nichts geschrieben.
	 */
	public Optional<EquipmentAudit> recordAvailabilityChange(Equipment equipment, Availability oldAvailability) {
		if (oldAvailability == equipment.getAvailability())
			return Optional.empty();
		EquipmentAudit audit = EquipmentAudit.of(equipment, oldAvailability, now());
		equipmentAuditRepository.append(audit);
		LOG.debugf("Equipment %d availability %s -> %s", equipment.getId(), oldAvailability,
				equipment.getAvailability());
		return Optional.of(audit);
	}

	/**
	 * Protokolliert einen Statuswechsel inklusive altem und neuem Budget; ohne Änderung wird nichts geschrieben.
	 */
	public Optional<FilmAudit> recordStatusChange(Film film, ProductionStatus oldStatus, BigDecimal oldBudget) {
		if (oldStatus == film.getProductionStatus())
			return Optional.empty();
		FilmAudit audit = FilmAudit.statusChange(film, oldStatus, oldBudget, now());
		filmAuditRepository.append(audit);
		LOG.debugf("Film %d status %s -> %s", film.getId(), oldStatus, film.getProductionStatus());
		return Optional.of(audit);
	}

	/**
	 * Eintrag der Operation "Produktionsstatus ändern". Wird zusätzlich zu {@link #recordStatusChange} geschrieben.
	 */
	public FilmAudit recordStatusUpdate(Film film, ProductionStatus oldStatus) {
		FilmAudit audit = FilmAudit.statusUpdate(film, oldStatus, now());
		filmAuditRepository.append(audit);
		return audit;
	}

	public UserActivityLog recordUserActivity(String username, UserActivityType type, String description) {
		return recordUserActivity(username, type, description, null);
	}

	public UserActivityLog recordUserActivity(String username, UserActivityType type, String description,
			String ipAddress) {
		UserActivityLog entry = UserActivityLog.of(username, type, description, ipAddress, now());
		userActivityLogRepository.append(entry);
		LOG.debugf("User activity %s for %s", type, username);
		return entry;
	}

	private RoleAudit appendRoleAudit(Role role, AuditAction action) {
		RoleAudit audit = RoleAudit.of(role, action, now());
		roleAuditRepository.append(audit);
		return audit;
	}

	private Instant now() {
		return Instant.now(clock);
	}
}
