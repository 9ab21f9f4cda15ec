package com.filmdb.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;

import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;

import com.filmdb.entity.Capability;
import com.filmdb.entity.UserAccount;
import com.filmdb.entity.UserActivityType;
import com.filmdb.entity.UserRole;
import com.filmdb.entity.dto.UserActivitySummaryDTO;
import com.filmdb.exception.AuthorizationException;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.InvariantException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.UserAccountRepository;
import com.filmdb.repository.UserActivityLogRepository;

/**
 * Benutzerverwaltung und Berechtigungsprüfung.
 * <p>
 * Die Berechtigungen einer Rolle sind fest in {@link UserRole} hinterlegt. Alle Verwaltungsoperationen verlangen
 * einen existierenden, aktiven Aufrufer mit {@link Capability#ADMINISTER}; ohne diese Berechtigung wird vor
 * jeder Änderung und ohne Audit-Eintrag abgebrochen.
 * <p>
 * Benutzername und E-Mail werden vor dem Anlegen geprüft; verliert ein paralleler Aufruf das Rennen, meldet der
 * sofortige Flush die Verletzung der Eindeutigkeit ebenfalls als {@link ConflictException}.
 * <p>
 * Mindestens ein aktiver Admin muss immer bestehen bleiben. Die Prüfung liest die aktiven Admins mit
 * Schreibsperre innerhalb derselben Transaktion wie die Änderung.
 */
@ApplicationScoped
public class AccessControlService {

	private static final Logger LOG = Logger.getLogger(AccessControlService.class);

	@Inject
	Clock clock;

	@Inject
	UserAccountRepository userAccountRepository;

	@Inject
	UserActivityLogRepository userActivityLogRepository;

	@Inject
	AuditService auditService;

	public AuthenticationResult authenticate(String username) {
		return userAccountRepository.findById(username)
				.map(user -> user.isActive() ? AuthenticationResult.AUTHORIZED : AuthenticationResult.INACTIVE)
				.orElse(AuthenticationResult.NOT_FOUND);
	}

	/**
	 * Berechtigungen eines Benutzers; leer für unbekannte oder deaktivierte Konten.
	 */
	public Set<Capability> capabilitiesOf(String username) {
		return userAccountRepository.findById(username)
				.filter(UserAccount::isActive)
				.map(user -> user.getRole().getCapabilities())
				.orElse(Collections.emptySet());
	}

	/**
	 * Liefert das Konto des Aufrufers, sofern es existiert, aktiv ist und die Berechtigung besitzt.
	 *
	 * @throws AuthorizationException sonst
	 */
	public UserAccount requireCapability(String caller, Capability capability) {
		return requireCapability(caller, capability, "User " + caller + " lacks " + capability + " permission");
	}

	@Transactional
	public UserAccount createUser(String caller, String username, String fullName, String email, UserRole role) {
		requireCapability(caller, Capability.ADMINISTER, "Only administrators can create users");
		if (username == null || username.isBlank())
			throw new ValidationException("Username is required");
		if (fullName == null || fullName.isBlank())
			throw new ValidationException("Full name is required");
		if (userAccountRepository.existsById(username))
			throw new ConflictException("User " + username + " already exists");
		if (email != null && userAccountRepository.findByEmail(email).isPresent())
			throw new ConflictException("Email " + email + " is already in use");

		UserAccount user = newAccount(username, fullName, email, role == null ? UserRole.VIEWER : role, caller);
		try {
			userAccountRepository.persist(user);
			userAccountRepository.flush();
		} catch (PersistenceException e) {
			if (!isConstraintViolation(e))
				throw e;
			LOG.warnf("Concurrent creation of user %s: %s", username, e.getMessage());
			throw new ConflictException("User " + username + " or email " + email + " already exists");
		}
		auditService.recordUserActivity(username, UserActivityType.USER_CREATED,
				"User " + username + " created with role " + user.getRole());
		LOG.infof("User %s created with role %s by %s", username, user.getRole(), caller);
		return user;
	}

	/**
	 * Aktiviert oder deaktiviert ein Konto. Ein unveränderter Status erzeugt keinen Audit-Eintrag.
	 */
	@Transactional
	public UserAccount updateStatus(String caller, String username, boolean active) {
		requireCapability(caller, Capability.ADMINISTER, "Only administrators can change user status");
		UserAccount user = getUser(username);
		if (user.isActive() == active)
			return user;
		if (!active && user.getRole() == UserRole.ADMIN)
			requireAnotherActiveAdmin("Cannot deactivate the last active administrator");

		user.setActive(active);
		String status = active ? "ACTIVE" : "INACTIVE";
		auditService.recordUserActivity(username, UserActivityType.USER_STATUS_CHANGE,
				"User " + username + " status changed to " + status + " by " + caller);
		LOG.infof("User %s set %s by %s", username, status, caller);
		return user;
	}

	@Transactional
	public UserAccount changeRole(String caller, String username, UserRole role) {
		requireCapability(caller, Capability.ADMINISTER, "Only administrators can change user roles");
		if (role == null)
			throw new ValidationException("Role is required");
		UserAccount user = getUser(username);
		UserRole oldRole = user.getRole();
		if (oldRole == role)
			return user;
		if (oldRole == UserRole.ADMIN && user.isActive())
			requireAnotherActiveAdmin("Cannot demote the last active administrator");

		user.setRole(role);
		auditService.recordUserActivity(username, UserActivityType.USER_ROLE_CHANGE,
				"User " + username + " role changed from " + oldRole + " to " + role + " by " + caller);
		LOG.infof("User %s role %s -> %s by %s", username, oldRole, role, caller);
		return user;
	}

	/**
	 * Löscht ein Konto. Der letzte aktive Admin kann nicht gelöscht werden; gezählt wird inklusive des Ziels.
	 */
	@Transactional
	public void deleteUser(String caller, String username) {
		requireCapability(caller, Capability.ADMINISTER, "Only administrators can delete users");
		UserAccount user = getUser(username);
		if (user.getRole() == UserRole.ADMIN && user.isActive())
			requireAnotherActiveAdmin("Cannot delete the last active administrator");

		userAccountRepository.delete(user);
		auditService.recordUserActivity(username, UserActivityType.USER_DELETED,
				"User " + username + " deleted by " + caller);
		LOG.infof("User %s deleted by %s", username, caller);
	}

	@Transactional
	public List<UserAccount> listUsers(String caller) {
		requireCapability(caller, Capability.ADMINISTER, "Only administrators can view all users");
		List<UserAccount> users = userAccountRepository.listAll();
		auditService.recordUserActivity(caller, UserActivityType.USER_LIST_VIEWED, "Viewed all users list");
		return users;
	}

	/**
	 * Aktivitätsübersicht aller Konten; Konten ohne Aktivität erscheinen mit Zählern 0.
	 */
	public List<UserActivitySummaryDTO> activitySummary(String caller) {
		requireCapability(caller, Capability.ADMINISTER, "Only administrators can view user activity");
		Map<String, Object[]> rows = userActivityLogRepository.summarizeByUsername().stream()
				.collect(Collectors.toMap(row -> (String) row[0], Function.identity()));
		return userAccountRepository.listAll().stream()
				.map(user -> toSummary(user, rows.get(user.getUsername())))
				.collect(Collectors.toList());
	}

	/**
	 * Protokolliert einen Anmeldeversuch. Ein erfolgreicher Versuch setzt zusätzlich den Zeitpunkt der letzten
	 * Anmeldung; fehlgeschlagene Versuche werden auch für unbekannte Benutzernamen protokolliert.
	 */
	@Transactional
	public void recordLogin(String username, boolean success, String ipAddress) {
		if (success) {
			UserAccount user = getUser(username);
			user.setLastLogin(Instant.now(clock));
			auditService.recordUserActivity(username, UserActivityType.LOGIN_SUCCESS, "User logged in",
					ipAddress);
		} else {
			auditService.recordUserActivity(username, UserActivityType.LOGIN_FAILED, "Failed login attempt",
					ipAddress);
			LOG.warnf("Failed login for %s from %s", username, ipAddress);
		}
	}

	/**
	 * Legt beim ersten Start einen Admin an, solange noch kein Konto existiert.
	 */
	@Transactional
	public Optional<UserAccount> bootstrapAdmin(String username, String fullName, String email) {
		if (userAccountRepository.count() > 0)
			return Optional.empty();
		UserAccount admin = newAccount(username, fullName, email, UserRole.ADMIN, null);
		userAccountRepository.persist(admin);
		auditService.recordUserActivity(username, UserActivityType.USER_CREATED,
				"User " + username + " created with role " + UserRole.ADMIN);
		LOG.infof("Bootstrapped administrator %s", username);
		return Optional.of(admin);
	}

	private UserAccount requireCapability(String caller, Capability capability, String message) {
		Optional<UserAccount> account = userAccountRepository.findById(caller);
		if (account.isEmpty() || !account.get().isActive() || !account.get().getRole().grants(capability)) {
			LOG.warnf("Denied %s for caller %s", capability, caller);
			throw new AuthorizationException(message);
		}
		return account.get();
	}

	private UserAccount getUser(String username) {
		return userAccountRepository.findById(username)
				.orElseThrow(() -> RecordNotFoundException.of("User", username));
	}

	private void requireAnotherActiveAdmin(String message) {
		if (userAccountRepository.lockActiveAdmins().size() <= 1)
			throw new InvariantException(message);
	}

	private UserAccount newAccount(String username, String fullName, String email, UserRole role, String createdBy) {
		UserAccount user = new UserAccount();
		user.setUsername(username);
		user.setFullName(fullName);
		user.setEmail(email);
		user.setRole(role);
		user.setActive(true);
		user.setCreatedAt(Instant.now(clock));
		user.setCreatedBy(createdBy);
		return user;
	}

	private static boolean isConstraintViolation(Throwable error) {
		for (Throwable cause = error; cause != null; cause = cause.getCause()) {
			if (cause instanceof ConstraintViolationException)
				return true;
		}
		return false;
	}

	private static UserActivitySummaryDTO toSummary(UserAccount user, Object[] row) {
		if (row == null)
			return new UserActivitySummaryDTO(user.getUsername(), user.getFullName(), user.getRole(), user.isActive(),
					0, null, 0, 0);
		return new UserActivitySummaryDTO(
				user.getUsername(),
				user.getFullName(),
				user.getRole(),
				user.isActive(),
				toLong(row[1]),
				(Instant) row[2],
				toLong(row[3]),
				toLong(row[4]));
	}

	private static long toLong(Object value) {
		return value == null ? 0L : ((Number) value).longValue();
	}
}
