package com.filmdb.config;

import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.filmdb.service.AccessControlService;

import io.quarkus.runtime.StartupEvent;

/**
 * Legt beim Start einen ersten Admin an, falls noch kein Benutzerkonto existiert.
 */
@Singleton
public class AdminBootstrap {

	@Inject
	AccessControlService accessControlService;

	@ConfigProperty(name = "filmdb.bootstrap.enabled", defaultValue = "true")
	boolean enabled;

	@ConfigProperty(name = "filmdb.bootstrap.admin-username", defaultValue = "admin")
	String username;

	@ConfigProperty(name = "filmdb.bootstrap.admin-full-name", defaultValue = "System Administrator")
	String fullName;

	@ConfigProperty(name = "filmdb.bootstrap.admin-email", defaultValue = "admin@filmdb.local")
	String email;

	void onStart(@Observes StartupEvent event) {
		if (enabled)
			accessControlService.bootstrapAdmin(username, fullName, email);
	}
}
