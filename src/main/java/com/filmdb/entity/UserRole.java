package com.filmdb.entity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Feste Rollenstufen der Benutzerverwaltung mit ihren unveränderlichen Berechtigungsmengen.
 */
public enum UserRole {
	ADMIN(EnumSet.of(Capability.READ, Capability.WRITE, Capability.ADMINISTER)),
	MANAGER(EnumSet.of(Capability.READ, Capability.WRITE)),
	VIEWER(EnumSet.of(Capability.READ));

	private final Set<Capability> capabilities;

	UserRole(EnumSet<Capability> capabilities) {
		this.capabilities = Collections.unmodifiableSet(capabilities);
	}

	public Set<Capability> getCapabilities() {
		return capabilities;
	}

	public boolean grants(Capability capability) {
		return capabilities.contains(capability);
	}
}
