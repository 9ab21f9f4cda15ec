package com.filmdb.repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.RoleAudit;

/**
 * Repository für das Audit-Protokoll der Rollenbesetzungen.
 */
@ApplicationScoped
public class RoleAuditRepository extends AuditRepository<RoleAudit> {

	public RoleAuditRepository() {
		super(RoleAudit.class);
	}

	public List<RoleAudit> find(Integer actorId, Integer filmId, Instant from, Instant to) {
		Map<String, Object> criteria = new LinkedHashMap<>();
		criteria.put("actorId", actorId);
		criteria.put("filmId", filmId);
		return listFiltered(criteria, from, to);
	}
}
