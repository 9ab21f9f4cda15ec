package com.filmdb.config;

import java.time.Clock;

import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * Stellt die Systemuhr bereit, damit Altersprüfung und Audit-Zeitstempel in Tests fixiert werden können.
 */
public class ClockProducer {

	@Produces
	@Singleton
	Clock clock() {
		return Clock.systemDefaultZone();
	}
}
