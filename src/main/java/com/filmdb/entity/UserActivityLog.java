package com.filmdb.entity;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Unveränderlicher Eintrag im Aktivitätsprotokoll der Benutzerverwaltung.
 */
@Entity
@Immutable
@Table(name = "user_activity_log", indexes = @Index(name = "idx_user_activity_username", columnList = "username"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserActivityLog {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 50)
	private String username;

	@Enumerated(EnumType.STRING)
	@Column(name = "action_type", nullable = false, length = 30)
	private UserActivityType actionType;

	@Column(name = "action_description", columnDefinition = "TEXT")
	private String actionDescription;

	@Column(name = "ip_address", length = 45)
	private String ipAddress;

	@Column(name = "logged_at", nullable = false)
	private Instant loggedAt;

	public static UserActivityLog of(String username, UserActivityType actionType, String description,
			String ipAddress, Instant loggedAt) {
		UserActivityLog log = new UserActivityLog();
		log.username = username;
		log.actionType = actionType;
		log.actionDescription = description;
		log.ipAddress = ipAddress;
		log.loggedAt = loggedAt;
		return log;
	}
}
