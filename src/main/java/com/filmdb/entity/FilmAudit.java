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
 * Unveränderlicher Audit-Eintrag für Statuswechsel eines Films.
 * <p>
 * {@link AuditAction#STATUS_CHANGE} entsteht bei jeder Film-Aktualisierung mit geändertem Status und trägt
 * beide Budgets, {@link AuditAction#STATUS_UPDATE} zusätzlich bei der Operation "Produktionsstatus ändern"
 * und trägt keine Budgets.
 */
@Entity
@Immutable
@Table(name = "film_audit")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FilmAudit {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(name = "film_id", nullable = false)
	private Integer filmId;

	@Column(name = "film_title", length = 200)
	private String filmTitle;

	@Enumerated(EnumType.STRING)
	@Column(name = "old_status", length = 20)
	private ProductionStatus oldStatus;

	@Enumerated(EnumType.STRING)
	@Column(name = "new_status", length = 20)
	private ProductionStatus newStatus;

	@Column(name = "old_budget", precision = 15, scale = 2)
	private BigDecimal oldBudget;

	@Column(name = "new_budget", precision = 15, scale = 2)
	private BigDecimal newBudget;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private AuditAction action;

	@Column(name = "logged_at", nullable = false)
	private Instant loggedAt;

	public static FilmAudit statusChange(Film film, ProductionStatus oldStatus, BigDecimal oldBudget,
			Instant loggedAt) {
		FilmAudit audit = base(film, oldStatus, AuditAction.STATUS_CHANGE, loggedAt);
		audit.oldBudget = oldBudget;
		audit.newBudget = film.getBudget();
		return audit;
	}

	public static FilmAudit statusUpdate(Film film, ProductionStatus oldStatus, Instant loggedAt) {
		return base(film, oldStatus, AuditAction.STATUS_UPDATE, loggedAt);
	}

	private static FilmAudit base(Film film, ProductionStatus oldStatus, AuditAction action, Instant loggedAt) {
		FilmAudit audit = new FilmAudit();
		audit.filmId = film.getId();
		audit.filmTitle = film.getTitle();
		audit.oldStatus = oldStatus;
		audit.newStatus = film.getProductionStatus();
		audit.action = action;
		audit.loggedAt = loggedAt;
		return audit;
	}
}
