package com.filmdb.entity;

import java.math.BigDecimal;
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
 * Unveränderlicher Audit-Eintrag für das Anlegen oder Entfernen einer Besetzung.
 */
@Entity
@Immutable
@Table(name = "role_audit")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RoleAudit {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "actor_id", nullable = false)
	private Integer actorId;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "character_name", length = 120)
	private String characterName;

	@Column(precision = 14, scale = 2)
	private BigDecimal salary;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private AuditAction action;

	@Column(name = "logged_at", nullable = false)
	private Instant loggedAt;

	public static RoleAudit of(Role role, AuditAction action, Instant loggedAt) {
		RoleAudit audit = new RoleAudit();
		audit.actorId = role.getActorId();
		audit.filmId = role.getFilmId();
		audit.characterName = role.getCharacterName();
		audit.salary = role.getSalary();
		audit.action = action;
		audit.loggedAt = loggedAt;
		return audit;
	}
}
