package com.filmdb.entity;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Unveränderlicher Audit-Eintrag für einen Wechsel der Equipment-Verfügbarkeit.
 */
@Entity
@Immutable
@Table(name = "equipment_audit")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class EquipmentAudit {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "equipment_id", nullable = false)
	private Integer equipmentId;

	@Column(name = "equipment_name", length = 120)
	private String equipmentName;

	@Enumerated(EnumType.STRING)
	@Column(name = "old_availability", length = 20)
	private Availability oldAvailability;

	@Enumerated(EnumType.STRING)
	@Column(name = "new_availability", length = 20)
	private Availability newAvailability;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private AuditAction action;

	@Column(name = "logged_at", nullable = false)
	private Instant loggedAt;

	public static EquipmentAudit of(Equipment equipment, Availability oldAvailability, Instant loggedAt) {
		EquipmentAudit audit = new EquipmentAudit();
		audit.equipmentId = equipment.getId();
		audit.equipmentName = equipment.getName();
		audit.oldAvailability = oldAvailability;
		audit.newAvailability = equipment.getAvailability();
		audit.action = AuditAction.UPDATE;
		audit.loggedAt = loggedAt;
		return audit;
	}
}
