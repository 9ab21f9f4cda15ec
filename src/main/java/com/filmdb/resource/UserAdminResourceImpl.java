package com.filmdb.resource;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;

import com.filmdb.entity.UserAccount;
import com.filmdb.entity.UserRole;
import com.filmdb.entity.dto.CreateUserRequestDTO;
import com.filmdb.entity.dto.UserActivitySummaryDTO;
import com.filmdb.service.AccessControlService;
import com.filmdb.service.AuthenticationResult;
import com.filmdb.service.ProductionOperationsService;

/**
 * Implementierung der Benutzerverwaltung; die Berechtigungsprüfung erfolgt im {@link AccessControlService}.
 */
public class UserAdminResourceImpl implements UserAdminResource {

	@Inject
	AccessControlService accessControlService;

	@Inject
	ProductionOperationsService operationsService;

	@Override
	public List<UserAccount> listUsers(String caller) {
		return accessControlService.listUsers(caller);
	}

	@Override
	public UserAccount createUser(String caller, CreateUserRequestDTO request) {
		return operationsService.createUser(caller, request.getUsername(), request.getFullName(),
				request.getEmail(), request.getRole());
	}

	@Override
	public UserAccount updateStatus(String caller, String username, Boolean active) {
		if (active == null) {
			throw new BadRequestException("Parameter 'active' is required");
		}
		return accessControlService.updateStatus(caller, username, active);
	}

	@Override
	public UserAccount changeRole(String caller, String username, UserRole role) {
		if (role == null) {
			throw new BadRequestException("Parameter 'role' is required");
		}
		return accessControlService.changeRole(caller, username, role);
	}

	@Override
	public void deleteUser(String caller, String username) {
		accessControlService.deleteUser(caller, username);
	}

	@Override
	public List<UserActivitySummaryDTO> activitySummary(String caller) {
		return accessControlService.activitySummary(caller);
	}

	@Override
	public AuthenticationResult authenticate(String username) {
		return accessControlService.authenticate(username);
	}
}
