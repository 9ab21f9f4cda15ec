package com.filmdb.entity;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.Getter;
import lombok.Setter;

/**
 * Equipment wie Kameras oder Tonausrüstung. Jeder Wechsel der Verfügbarkeit wird protokolliert.
 */
@Entity
@Table(name = "equipment")
@Getter
@Setter
public class Equipment {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 120)
	private String name;

	@Column(length = 60)
	private String type;

	@Column(precision = 12, scale = 2)
	private BigDecimal cost = BigDecimal.ZERO;

	@Column(name = "purchase_date")
	private LocalDate purchaseDate;

	@Column(name = "equipment_condition", length = 30)
	private String condition = "Good";

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private Availability availability = Availability.AVAILABLE;
}
