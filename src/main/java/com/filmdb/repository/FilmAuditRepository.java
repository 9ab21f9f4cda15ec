package com.filmdb.repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.FilmAudit;

/**
 * Repository für das Audit-Protokoll der Statuswechsel von Filmen.
 */
@ApplicationScoped
public class FilmAuditRepository extends AuditRepository<FilmAudit> {

	public FilmAuditRepository() {
		super(FilmAudit.class);
	}

	public List<FilmAudit> find(Integer filmId, Instant from, Instant to) {
		Map<String, Object> criteria = new LinkedHashMap<>();
		criteria.put("filmId", filmId);
		return listFiltered(criteria, from, to);
	}
}
