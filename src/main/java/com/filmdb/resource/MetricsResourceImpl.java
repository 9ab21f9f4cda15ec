package com.filmdb.resource;

import java.math.BigDecimal;

import jakarta.inject.Inject;

import com.filmdb.entity.Capability;
import com.filmdb.entity.dto.FilmMetricsDTO;
import com.filmdb.service.AccessControlService;
import com.filmdb.service.FilmMetricsService;

import io.micrometer.core.annotation.Timed;

/**
 * Implementierung der Kennzahlen-Endpunkte; erfordert Leserecht.
 */
public class MetricsResourceImpl implements MetricsResource {

	@Inject
	FilmMetricsService metricsService;

	@Inject
	AccessControlService accessControlService;

	@Override
	@Timed(value = "filmdb.http.metrics.film", description = "Laufzeit der Kennzahlen eines Films")
	public FilmMetricsDTO filmMetrics(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return metricsService.metricsOf(filmId);
	}

	@Override
	public int actorAge(String caller, int actorId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return metricsService.age(actorId);
	}

	@Override
	public long actorScreenTime(String caller, int actorId, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return metricsService.actorScreenTime(actorId, filmId);
	}

	@Override
	public long directorFilmCount(String caller, int directorId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return metricsService.filmCount(directorId);
	}

	@Override
	public BigDecimal producerInvestment(String caller, int producerId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return metricsService.totalInvestment(producerId);
	}

	@Override
	public String equipmentAvailability(String caller, int equipmentId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return metricsService.equipmentAvailability(equipmentId);
	}
}
