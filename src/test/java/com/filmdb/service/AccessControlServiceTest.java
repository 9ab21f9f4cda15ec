package com.filmdb.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.PersistenceException;

import org.hibernate.exception.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.filmdb.entity.Capability;
import com.filmdb.entity.UserAccount;
import com.filmdb.entity.UserActivityType;
import com.filmdb.entity.UserRole;
import com.filmdb.entity.dto.UserActivitySummaryDTO;
import com.filmdb.exception.AuthorizationException;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.InvariantException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.repository.UserAccountRepository;
import com.filmdb.repository.UserActivityLogRepository;

@ExtendWith(MockitoExtension.class)
class AccessControlServiceTest {

	@Mock
	UserAccountRepository userAccountRepository;

	@Mock
	UserActivityLogRepository userActivityLogRepository;

	@Mock
	AuditService auditService;

	@InjectMocks
	AccessControlService service;

	private final UserAccount admin = Fixtures.user("admin", UserRole.ADMIN, true);

	@BeforeEach
	void setUp() {
		service.clock = Fixtures.CLOCK;
	}

	// ========================================
	// authenticate / capabilities
	// ========================================

	@Test
	@DisplayName("authenticate distinguishes active, inactive and unknown accounts")
	void authenticate_shouldReportAccountState() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.findById("old")).thenReturn(Optional.of(Fixtures.user("old", UserRole.VIEWER, false)));
		when(userAccountRepository.findById("nobody")).thenReturn(Optional.empty());

		assertThat(service.authenticate("admin")).isEqualTo(AuthenticationResult.AUTHORIZED);
		assertThat(service.authenticate("old")).isEqualTo(AuthenticationResult.INACTIVE);
		assertThat(service.authenticate("nobody")).isEqualTo(AuthenticationResult.NOT_FOUND);
	}

	@Test
	@DisplayName("capability tiers are fixed per role")
	void capabilities_shouldFollowRoleTiers() {
		when(userAccountRepository.findById("mia")).thenReturn(Optional.of(Fixtures.user("mia", UserRole.MANAGER, true)));
		when(userAccountRepository.findById("vic")).thenReturn(Optional.of(Fixtures.user("vic", UserRole.VIEWER, true)));

		assertThat(service.capabilitiesOf("mia")).containsExactlyInAnyOrder(Capability.READ, Capability.WRITE);
		assertThat(service.capabilitiesOf("vic")).containsExactly(Capability.READ);
		assertThat(UserRole.ADMIN.getCapabilities())
				.containsExactlyInAnyOrder(Capability.READ, Capability.WRITE, Capability.ADMINISTER);
	}

	@Test
	@DisplayName("a viewer is denied write access")
	void requireCapability_shouldDenyViewerWrite() {
		when(userAccountRepository.findById("vic")).thenReturn(Optional.of(Fixtures.user("vic", UserRole.VIEWER, true)));

		assertThatThrownBy(() -> service.requireCapability("vic", Capability.WRITE))
				.isInstanceOf(AuthorizationException.class);
	}

	// ========================================
	// createUser
	// ========================================

	@Test
	@DisplayName("createUser by a manager fails without creating the account or an audit entry")
	void createUser_shouldRejectNonAdmin_withoutSideEffects() {
		// Arrange
		when(userAccountRepository.findById("mia")).thenReturn(Optional.of(Fixtures.user("mia", UserRole.MANAGER, true)));

		// Act & Assert
		assertThatThrownBy(() -> service.createUser("mia", "bob", "Bob Stone", "bob@filmdb.test", UserRole.MANAGER))
				.isInstanceOf(AuthorizationException.class);

		verify(userAccountRepository, never()).persist(any(UserAccount.class));
		verifyNoInteractions(auditService);
	}

	@Test
	@DisplayName("createUser by an unknown or inactive caller is rejected")
	void createUser_shouldRejectUnknownAndInactiveCallers() {
		when(userAccountRepository.findById("ghost")).thenReturn(Optional.empty());
		when(userAccountRepository.findById("retired"))
				.thenReturn(Optional.of(Fixtures.user("retired", UserRole.ADMIN, false)));

		assertThatThrownBy(() -> service.createUser("ghost", "bob", "Bob Stone", null, UserRole.VIEWER))
				.isInstanceOf(AuthorizationException.class);
		assertThatThrownBy(() -> service.createUser("retired", "bob", "Bob Stone", null, UserRole.VIEWER))
				.isInstanceOf(AuthorizationException.class);
		verifyNoInteractions(auditService);
	}

	@Test
	@DisplayName("createUser by an admin persists the account and records USER_CREATED")
	void createUser_shouldPersistAndAudit() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.existsById("bob")).thenReturn(false);
		when(userAccountRepository.findByEmail("bob@filmdb.test")).thenReturn(Optional.empty());

		UserAccount bob = service.createUser("admin", "bob", "Bob Stone", "bob@filmdb.test", UserRole.MANAGER);

		assertThat(bob.getRole()).isEqualTo(UserRole.MANAGER);
		assertThat(bob.isActive()).isTrue();
		assertThat(bob.getCreatedBy()).isEqualTo("admin");
		assertThat(bob.getCreatedAt()).isEqualTo(Fixtures.NOW);
		verify(userAccountRepository).persist(bob);
		verify(auditService).recordUserActivity("bob", UserActivityType.USER_CREATED,
				"User bob created with role MANAGER");
	}

	@Test
	@DisplayName("createUser with an existing username or email is a conflict")
	void createUser_shouldRejectDuplicates() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.existsById("bob")).thenReturn(true);
		when(userAccountRepository.existsById("rob")).thenReturn(false);
		when(userAccountRepository.findByEmail("bob@filmdb.test"))
				.thenReturn(Optional.of(Fixtures.user("bob", UserRole.VIEWER, true)));

		assertThatThrownBy(() -> service.createUser("admin", "bob", "Bob Stone", "x@filmdb.test", UserRole.VIEWER))
				.isInstanceOf(ConflictException.class);
		assertThatThrownBy(() -> service.createUser("admin", "rob", "Rob Stone", "bob@filmdb.test", UserRole.VIEWER))
				.isInstanceOf(ConflictException.class);
		verifyNoInteractions(auditService);
	}

	@Test
	@DisplayName("a unique key violation on flush from a concurrent insert becomes a conflict without audit")
	void createUser_shouldTranslateConcurrentDuplicate() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.existsById("bob")).thenReturn(false);
		when(userAccountRepository.findByEmail("bob@filmdb.test")).thenReturn(Optional.empty());
		doThrow(new PersistenceException("duplicate key",
				new ConstraintViolationException("duplicate key", new SQLException("duplicate"), "uk_user_email")))
				.when(userAccountRepository).flush();

		assertThatThrownBy(() -> service.createUser("admin", "bob", "Bob Stone", "bob@filmdb.test", UserRole.VIEWER))
				.isInstanceOf(ConflictException.class);
		verifyNoInteractions(auditService);
	}

	@Test
	@DisplayName("other persistence failures on flush are not turned into a conflict")
	void createUser_shouldPropagateOtherPersistenceFailures() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.existsById("bob")).thenReturn(false);
		doThrow(new PersistenceException("connection lost")).when(userAccountRepository).flush();

		assertThatThrownBy(() -> service.createUser("admin", "bob", "Bob Stone", null, UserRole.VIEWER))
				.isInstanceOf(PersistenceException.class)
				.isNotInstanceOf(ConflictException.class);
		verifyNoInteractions(auditService);
	}

	// ========================================
	// deleteUser
	// ========================================

	@Test
	@DisplayName("deleting the sole active admin fails and keeps the account")
	void deleteUser_shouldRejectLastActiveAdmin() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.lockActiveAdmins()).thenReturn(List.of(admin));

		assertThatThrownBy(() -> service.deleteUser("admin", "admin"))
				.isInstanceOf(InvariantException.class)
				.hasMessage("Cannot delete the last active administrator");

		verify(userAccountRepository, never()).delete(any(UserAccount.class));
		verifyNoInteractions(auditService);
	}

	@Test
	@DisplayName("deleting one of two active admins succeeds")
	void deleteUser_shouldDeleteNonLastAdmin() {
		// Arrange
		UserAccount second = Fixtures.user("ops", UserRole.ADMIN, true);
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.findById("ops")).thenReturn(Optional.of(second));
		when(userAccountRepository.lockActiveAdmins()).thenReturn(List.of(admin, second));

		// Act
		service.deleteUser("admin", "ops");

		// Assert
		verify(userAccountRepository).delete(second);
		verify(auditService).recordUserActivity("ops", UserActivityType.USER_DELETED, "User ops deleted by admin");
		verify(userAccountRepository, never()).delete(admin);
	}

	@Test
	@DisplayName("deleting an unknown user fails with RecordNotFoundException")
	void deleteUser_shouldFailForUnknownTarget() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.findById("nobody")).thenReturn(Optional.empty());

		assertThatThrownBy(() -> service.deleteUser("admin", "nobody")).isInstanceOf(RecordNotFoundException.class);
	}

	@Test
	@DisplayName("deleting a viewer does not consult the admin count")
	void deleteUser_shouldSkipAdminCheckForViewer() {
		UserAccount viewer = Fixtures.user("vic", UserRole.VIEWER, true);
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.findById("vic")).thenReturn(Optional.of(viewer));

		service.deleteUser("admin", "vic");

		verify(userAccountRepository, never()).lockActiveAdmins();
		verify(userAccountRepository).delete(viewer);
	}

	// ========================================
	// updateStatus / changeRole
	// ========================================

	@Test
	@DisplayName("deactivating the last active admin is rejected")
	void updateStatus_shouldRejectDeactivatingLastAdmin() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.lockActiveAdmins()).thenReturn(List.of(admin));

		assertThatThrownBy(() -> service.updateStatus("admin", "admin", false))
				.isInstanceOf(InvariantException.class);
		assertThat(admin.isActive()).isTrue();
	}

	@Test
	@DisplayName("deactivating a manager records USER_STATUS_CHANGE")
	void updateStatus_shouldAuditChange() {
		UserAccount manager = Fixtures.user("mia", UserRole.MANAGER, true);
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.findById("mia")).thenReturn(Optional.of(manager));

		service.updateStatus("admin", "mia", false);

		assertThat(manager.isActive()).isFalse();
		verify(auditService).recordUserActivity("mia", UserActivityType.USER_STATUS_CHANGE,
				"User mia status changed to INACTIVE by admin");
	}

	@Test
	@DisplayName("setting the current status again is a no-op without audit")
	void updateStatus_shouldSkipUnchangedStatus() {
		UserAccount manager = Fixtures.user("mia", UserRole.MANAGER, true);
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.findById("mia")).thenReturn(Optional.of(manager));

		service.updateStatus("admin", "mia", true);

		verifyNoInteractions(auditService);
	}

	@Test
	@DisplayName("demoting the last active admin is rejected")
	void changeRole_shouldRejectDemotingLastAdmin() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.lockActiveAdmins()).thenReturn(List.of(admin));

		assertThatThrownBy(() -> service.changeRole("admin", "admin", UserRole.VIEWER))
				.isInstanceOf(InvariantException.class);
		assertThat(admin.getRole()).isEqualTo(UserRole.ADMIN);
	}

	// ========================================
	// listUsers / activity / login
	// ========================================

	@Test
	@DisplayName("listUsers records the view against the caller")
	void listUsers_shouldAuditCaller() {
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.listAll()).thenReturn(List.of(admin));

		assertThat(service.listUsers("admin")).containsExactly(admin);
		verify(auditService).recordUserActivity("admin", UserActivityType.USER_LIST_VIEWED, "Viewed all users list");
	}

	@Test
	@DisplayName("activity summary includes accounts without any activity")
	void activitySummary_shouldIncludeSilentAccounts() {
		UserAccount viewer = Fixtures.user("vic", UserRole.VIEWER, true);
		when(userAccountRepository.findById("admin")).thenReturn(Optional.of(admin));
		when(userAccountRepository.listAll()).thenReturn(List.of(admin, viewer));
		List<Object[]> rows = new ArrayList<>();
		rows.add(new Object[] { "admin", 5L, Fixtures.NOW, 3L, 1L });
		when(userActivityLogRepository.summarizeByUsername()).thenReturn(rows);

		List<UserActivitySummaryDTO> summary = service.activitySummary("admin");

		assertThat(summary).extracting(UserActivitySummaryDTO::username).containsExactly("admin", "vic");
		assertThat(summary.get(0).successfulLogins()).isEqualTo(3);
		assertThat(summary.get(0).failedLogins()).isEqualTo(1);
		assertThat(summary.get(1).totalActivities()).isZero();
		assertThat(summary.get(1).lastActivity()).isNull();
	}

	@Test
	@DisplayName("a successful login sets last login and records the address")
	void recordLogin_shouldSetLastLogin_onSuccess() {
		UserAccount viewer = Fixtures.user("vic", UserRole.VIEWER, true);
		when(userAccountRepository.findById("vic")).thenReturn(Optional.of(viewer));

		service.recordLogin("vic", true, "192.168.1.20");

		assertThat(viewer.getLastLogin()).isEqualTo(Fixtures.NOW);
		verify(auditService).recordUserActivity("vic", UserActivityType.LOGIN_SUCCESS, "User logged in",
				"192.168.1.20");
	}

	@Test
	@DisplayName("a failed login is recorded even for an unknown username")
	void recordLogin_shouldRecordFailureForUnknownUser() {
		service.recordLogin("intruder", false, "203.0.113.9");

		verify(auditService).recordUserActivity("intruder", UserActivityType.LOGIN_FAILED, "Failed login attempt",
				"203.0.113.9");
		verify(userAccountRepository, never()).findById(anyString());
	}

	@Test
	@DisplayName("bootstrap creates an admin only while no account exists")
	void bootstrapAdmin_shouldOnlyRunOnEmptyStore() {
		when(userAccountRepository.count()).thenReturn(0L, 1L);

		Optional<UserAccount> first = service.bootstrapAdmin("admin", "System Administrator", "admin@filmdb.local");
		Optional<UserAccount> second = service.bootstrapAdmin("admin", "System Administrator", "admin@filmdb.local");

		assertThat(first).hasValueSatisfying(user -> assertThat(user.getRole()).isEqualTo(UserRole.ADMIN));
		assertThat(second).isEmpty();
		verify(userAccountRepository).persist(first.get());
	}
}
