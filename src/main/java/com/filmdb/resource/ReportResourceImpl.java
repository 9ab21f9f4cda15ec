package com.filmdb.resource;

import java.util.List;

import jakarta.inject.Inject;

import com.filmdb.entity.Capability;
import com.filmdb.entity.dto.ActorAwardHistoryDTO;
import com.filmdb.entity.dto.ActorFilmographyEntryDTO;
import com.filmdb.entity.dto.BoxOfficeEntryDTO;
import com.filmdb.entity.dto.CrewPayrollEntryDTO;
import com.filmdb.entity.dto.DirectorFilmographyEntryDTO;
import com.filmdb.entity.dto.DistributorPerformanceDTO;
import com.filmdb.entity.dto.EquipmentUsageReportEntryDTO;
import com.filmdb.entity.dto.FilmProductionSummaryDTO;
import com.filmdb.entity.dto.ProducerInvestmentSummaryDTO;
import com.filmdb.service.AccessControlService;
import com.filmdb.service.ReportService;

import io.micrometer.core.annotation.Timed;

/**
 * Implementierung der Auswertungs-Endpunkte; erfordert Leserecht.
 */
public class ReportResourceImpl implements ReportResource {

	@Inject
	ReportService reportService;

	@Inject
	AccessControlService accessControlService;

	@Override
	public FilmProductionSummaryDTO productionSummary(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.productionSummary(filmId);
	}

	@Override
	public List<CrewPayrollEntryDTO> crewPayroll(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.crewPayroll(filmId);
	}

	@Override
	public List<EquipmentUsageReportEntryDTO> equipmentUsage(String caller, int filmId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.equipmentUsageReport(filmId);
	}

	@Override
	public ActorAwardHistoryDTO actorAwards(String caller, int actorId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.actorAwardHistory(actorId);
	}

	@Override
	public List<ActorFilmographyEntryDTO> actorFilmography(String caller, int actorId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.actorFilmography(actorId);
	}

	@Override
	public List<DirectorFilmographyEntryDTO> directorFilmography(String caller, int directorId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.directorFilmography(directorId);
	}

	@Override
	public ProducerInvestmentSummaryDTO producerInvestment(String caller, int producerId) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.producerInvestment(producerId);
	}

	@Override
	@Timed(value = "filmdb.http.reports.box-office", description = "Laufzeit der Einspielanalyse über alle Filme")
	public List<BoxOfficeEntryDTO> boxOffice(String caller) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.boxOfficeAnalysis();
	}

	@Override
	@Timed(value = "filmdb.http.reports.distributors", description = "Laufzeit der Verleiherauswertung")
	public List<DistributorPerformanceDTO> distributorPerformance(String caller) {
		accessControlService.requireCapability(caller, Capability.READ);
		return reportService.distributorPerformance();
	}
}
