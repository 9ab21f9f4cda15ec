package com.filmdb.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.filmdb.entity.AuditAction;
import com.filmdb.entity.Importance;
import com.filmdb.entity.Role;
import com.filmdb.entity.RoleAudit;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.ActorRepository;
import com.filmdb.repository.EquipmentAuditRepository;
import com.filmdb.repository.FilmAuditRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.RoleAuditRepository;
import com.filmdb.repository.RoleRepository;
import com.filmdb.repository.UserActivityLogRepository;

@ExtendWith(MockitoExtension.class)
class CastingServiceTest {

	@Mock
	RoleRepository roleRepository;

	@Mock
	ActorRepository actorRepository;

	@Mock
	FilmRepository filmRepository;

	@Mock
	RoleAuditRepository roleAuditRepository;

	@Mock
	EquipmentAuditRepository equipmentAuditRepository;

	@Mock
	FilmAuditRepository filmAuditRepository;

	@Mock
	UserActivityLogRepository userActivityLogRepository;

	@InjectMocks
	CastingService service;

	@BeforeEach
	void setUp() {
		AuditService audit = new AuditService();
		audit.clock = Fixtures.CLOCK;
		audit.roleAuditRepository = roleAuditRepository;
		audit.equipmentAuditRepository = equipmentAuditRepository;
		audit.filmAuditRepository = filmAuditRepository;
		audit.userActivityLogRepository = userActivityLogRepository;
		service.auditService = audit;
		service.validationService = Fixtures.validationService();
	}

	@Test
	@DisplayName("castRole should persist the role and append exactly one INSERT entry")
	void castRole_shouldPersistAndAudit() {
		// Arrange
		Role role = role(2, 1, "Maya", 45_000);
		when(actorRepository.existsById(2)).thenReturn(true);
		when(filmRepository.existsById(1)).thenReturn(true);
		when(roleRepository.existsByActorFilmAndCharacter(2, 1, "Maya")).thenReturn(false);

		// Act
		Role result = service.castRole(role);

		// Assert
		assertThat(result).isSameAs(role);
		verify(roleRepository).persist(role);
		ArgumentCaptor<RoleAudit> captor = ArgumentCaptor.forClass(RoleAudit.class);
		verify(roleAuditRepository).append(captor.capture());
		assertThat(captor.getValue().getAction()).isEqualTo(AuditAction.INSERT);
		assertThat(captor.getValue().getCharacterName()).isEqualTo("Maya");
	}

	@Test
	@DisplayName("castRole with negative salary fails before any lookup, write or audit")
	void castRole_shouldRejectNegativeSalary_withoutSideEffects() {
		Role role = role(2, 1, "Maya", -100);

		assertThatThrownBy(() -> service.castRole(role))
				.isInstanceOf(ValidationException.class)
				.hasMessage("Role salary cannot be negative");

		verify(roleRepository, never()).persist(any(Role.class));
		verifyNoInteractions(roleAuditRepository, actorRepository, filmRepository);
	}

	@Test
	@DisplayName("castRole should fail with ConflictException for a duplicate actor, film and character")
	void castRole_shouldRejectDuplicateTriple() {
		when(actorRepository.existsById(2)).thenReturn(true);
		when(filmRepository.existsById(1)).thenReturn(true);
		when(roleRepository.existsByActorFilmAndCharacter(2, 1, "Maya")).thenReturn(true);

		assertThatThrownBy(() -> service.castRole(role(2, 1, "Maya", 100)))
				.isInstanceOf(ConflictException.class);
		verifyNoInteractions(roleAuditRepository);
	}

	@Test
	@DisplayName("castRole should fail with RecordNotFoundException for an unknown actor")
	void castRole_shouldRejectUnknownActor() {
		when(actorRepository.existsById(99)).thenReturn(false);

		assertThatThrownBy(() -> service.castRole(role(99, 1, "Ghost", 100)))
				.isInstanceOf(RecordNotFoundException.class)
				.hasMessage("Actor 99 not found");
	}

	@Test
	@DisplayName("role audit count for a pair equals successful inserts plus deletes")
	void auditCount_shouldMatchInsertsPlusDeletes() {
		// Arrange
		Role first = role(2, 1, "Maya", 1_000);
		Role second = role(2, 1, "Maya's Twin", 1_000);
		first.setId(10);
		when(actorRepository.existsById(2)).thenReturn(true);
		when(filmRepository.existsById(1)).thenReturn(true);
		when(roleRepository.existsByActorFilmAndCharacter(2, 1, "Maya")).thenReturn(false);
		when(roleRepository.existsByActorFilmAndCharacter(2, 1, "Maya's Twin")).thenReturn(false);
		when(roleRepository.findById(10)).thenReturn(Optional.of(first));

		// Act
		service.castRole(first);
		service.castRole(second);
		service.removeRole(10);

		// Assert
		ArgumentCaptor<RoleAudit> captor = ArgumentCaptor.forClass(RoleAudit.class);
		verify(roleAuditRepository, times(3)).append(captor.capture());
		assertThat(captor.getAllValues()).extracting(RoleAudit::getAction)
				.containsExactly(AuditAction.INSERT, AuditAction.INSERT, AuditAction.DELETE);
		assertThat(captor.getAllValues()).allSatisfy(audit -> {
			assertThat(audit.getActorId()).isEqualTo(2);
			assertThat(audit.getFilmId()).isEqualTo(1);
		});
	}

	@Test
	@DisplayName("removing the roles of a film audits every single deletion")
	void removeRolesForFilm_shouldAuditEachRole() {
		Role lead = role(2, 1, "Maya", 1_000);
		Role cameo = role(3, 1, "Passer-by", 0);
		when(roleRepository.findByFilmId(1)).thenReturn(List.of(lead, cameo));

		int removed = service.removeRolesForFilm(1);

		assertThat(removed).isEqualTo(2);
		verify(roleRepository).delete(lead);
		verify(roleRepository).delete(cameo);
		verify(roleAuditRepository, times(2)).append(any(RoleAudit.class));
	}

	// ==================== Änderungen ====================

	@Test
	@DisplayName("updating a role with a negative salary leaves it untouched")
	void updateRole_shouldRejectNegativeSalary() {
		Role stored = role(2, 1, "Maya", 1_000);
		when(roleRepository.findById(5)).thenReturn(Optional.of(stored));

		assertThatThrownBy(() -> service.updateRole(5, role(2, 1, "Maya", -1)))
				.isInstanceOf(ValidationException.class);
		assertThat(stored.getSalary()).isEqualByComparingTo("1000");
	}

	@Test
	@DisplayName("renaming a role to a character the actor already plays in the film is a conflict")
	void updateRole_shouldRejectExistingCharacter() {
		Role stored = role(2, 1, "Maya", 1_000);
		when(roleRepository.findById(5)).thenReturn(Optional.of(stored));
		when(roleRepository.existsByActorFilmAndCharacter(2, 1, "Ines")).thenReturn(true);

		assertThatThrownBy(() -> service.updateRole(5, role(2, 1, "Ines", 1_000)))
				.isInstanceOf(ConflictException.class);
		assertThat(stored.getCharacterName()).isEqualTo("Maya");
	}

	@Test
	@DisplayName("a role update keeps actor and film and writes no audit entry")
	void updateRole_shouldKeepActorAndFilm() {
		Role stored = role(2, 1, "Maya", 1_000);
		when(roleRepository.findById(5)).thenReturn(Optional.of(stored));
		Role changes = role(9, 8, "Maya", 2_500);
		changes.setScreenTime(40);

		Role updated = service.updateRole(5, changes);

		assertThat(updated.getActorId()).isEqualTo(2);
		assertThat(updated.getFilmId()).isEqualTo(1);
		assertThat(updated.getScreenTime()).isEqualTo(40);
		assertThat(updated.getSalary()).isEqualByComparingTo("2500");
		verifyNoInteractions(roleAuditRepository);
	}

	private static Role role(Integer actorId, Integer filmId, String character, long salary) {
		Role role = new Role();
		role.setActorId(actorId);
		role.setFilmId(filmId);
		role.setCharacterName(character);
		role.setScreenTime(0);
		role.setImportance(Importance.SUPPORTING);
		role.setSalary(BigDecimal.valueOf(salary));
		return role;
	}
}
