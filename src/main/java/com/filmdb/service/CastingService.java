package com.filmdb.service;

import java.util.List;
import java.util.Objects;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import com.filmdb.entity.Role;
import com.filmdb.exception.ConflictException;
import com.filmdb.exception.RecordNotFoundException;
import com.filmdb.exception.ValidationException;
import com.filmdb.repository.ActorRepository;
import com.filmdb.repository.FilmRepository;
import com.filmdb.repository.RoleRepository;

/**
 * Verwaltet Besetzungen (Rollen) eines Schauspielers in einem Film. Jedes Anlegen und Löschen wird auditiert.
 */
@ApplicationScoped
public class CastingService {

	private static final Logger LOG = Logger.getLogger(CastingService.class);

	@Inject
	RoleRepository roleRepository;

	@Inject
	ActorRepository actorRepository;

	@Inject
	FilmRepository filmRepository;

	@Inject
	ValidationService validationService;

	@Inject
	AuditService auditService;

	public Role getRole(Integer roleId) {
		return roleRepository.findById(roleId).orElseThrow(() -> RecordNotFoundException.of("Role", roleId));
	}

	public List<Role> rolesForFilm(Integer filmId) {
		return roleRepository.findByFilmId(filmId);
	}

	public List<Role> rolesForActor(Integer actorId) {
		return roleRepository.findByActorId(actorId);
	}

	/**
	 * Legt eine Rolle an. Reihenfolge: Gehaltsprüfung, Existenz von Schauspieler und Film, Eindeutigkeit von
	 * (Schauspieler, Film, Rollenname), Speichern, Audit-Eintrag INSERT.
	 */
	@Transactional
	public Role castRole(Role role) {
		validationService.validateRole(role);
		if (!actorRepository.existsById(role.getActorId()))
			throw RecordNotFoundException.of("Actor", role.getActorId());
		if (!filmRepository.existsById(role.getFilmId()))
			throw RecordNotFoundException.of("Film", role.getFilmId());
		if (roleRepository.existsByActorFilmAndCharacter(role.getActorId(), role.getFilmId(),
				role.getCharacterName()))
			throw new ConflictException("Actor " + role.getActorId() + " already plays '" + role.getCharacterName()
					+ "' in film " + role.getFilmId());

		roleRepository.persist(role);
		auditService.recordRoleInsert(role);
		LOG.infof("Cast actor %d as '%s' in film %d", role.getActorId(), role.getCharacterName(),
				role.getFilmId());
		return role;
	}

	/**
	 * Ändert Rollenname, Leinwandzeit, Bedeutung und Gage. Schauspieler und Film einer Rolle bleiben fest; wer
	 * umbesetzen will, löscht die Rolle und legt sie neu an, damit beide Vorgänge auditiert werden.
	 */
	@Transactional
	public Role updateRole(Integer roleId, Role changes) {
		Role role = getRole(roleId);
		validationService.validateRole(changes);
		if (changes.getScreenTime() != null && changes.getScreenTime() < 0)
			throw new ValidationException("Screen time cannot be negative");
		String characterName = changes.getCharacterName();
		if (!Objects.equals(characterName, role.getCharacterName())
				&& roleRepository.existsByActorFilmAndCharacter(role.getActorId(), role.getFilmId(), characterName))
			throw new ConflictException("Actor " + role.getActorId() + " already plays '" + characterName
					+ "' in film " + role.getFilmId());

		role.setCharacterName(characterName);
		role.setScreenTime(changes.getScreenTime());
		if (changes.getImportance() != null)
			role.setImportance(changes.getImportance());
		if (changes.getSalary() != null)
			role.setSalary(changes.getSalary());
		return role;
	}

	@Transactional
	public void removeRole(Integer roleId) {
		Role role = getRole(roleId);
		delete(role);
	}

	/**
	 * Entfernt alle Rollen eines Films einzeln, damit jede Löschung einen eigenen Audit-Eintrag erhält.
	 */
	@Transactional
	public int removeRolesForFilm(Integer filmId) {
		List<Role> roles = roleRepository.findByFilmId(filmId);
		roles.forEach(this::delete);
		return roles.size();
	}

	@Transactional
	public int removeRolesForActor(Integer actorId) {
		List<Role> roles = roleRepository.findByActorId(actorId);
		roles.forEach(this::delete);
		return roles.size();
	}

	private void delete(Role role) {
		roleRepository.delete(role);
		auditService.recordRoleDelete(role);
		LOG.debugf("Removed role %d ('%s')", role.getId(), role.getCharacterName());
	}
}
