package com.filmdb.repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import com.filmdb.entity.EquipmentAudit;

/**
 * Repository für das Audit-Protokoll der Equipment-Verfügbarkeit.
 */
@ApplicationScoped
public class EquipmentAuditRepository extends AuditRepository<EquipmentAudit> {

	public EquipmentAuditRepository() {
		super(EquipmentAudit.class);
	}

	public List<EquipmentAudit> find(Integer equipmentId, Instant from, Instant to) {
		Map<String, Object> criteria = new LinkedHashMap<>();
		criteria.put("equipmentId", equipmentId);
		return listFiltered(criteria, from, to);
	}
}
