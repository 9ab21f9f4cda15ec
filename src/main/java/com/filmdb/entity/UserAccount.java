package com.filmdb.entity;

import java.time.Instant;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.Getter;
import lombok.Setter;

/**
 * Benutzerkonto der Zugriffskontrolle. Der Benutzername ist zugleich Primärschlüssel.
 */
@Entity
@Table(name = "user_account")
@Getter
@Setter
public class UserAccount {
	@Id
	@Column(length = 50)
	private String username;

	@Column(name = "full_name", nullable = false, length = 120)
	private String fullName;

	@Column(unique = true, length = 120)
	private String email;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private UserRole role = UserRole.VIEWER;

	@Column(name = "is_active", nullable = false)
	private boolean active = true;

	@Column(name = "created_at", updatable = false)
	private Instant createdAt;

	@Column(name = "created_by", length = 50)
	private String createdBy;

	@Column(name = "last_login")
	private Instant lastLogin;
}
