package com.filmdb.entity;

import java.time.LocalDate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.Getter;
import lombok.Setter;

/**
 * Produzent, der über {@link ProducedBy} in Filme investiert.
 */
@Entity
@Table(name = "producer")
@Getter
@Setter
public class Producer {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Integer id;

	@Column(nullable = false, length = 120)
	private String name;

	@Column(length = 120)
	private String company;

	@Column(length = 50)
	private String contact;

	@Column(length = 120)
	private String email;

	@Column(name = "date_of_birth")
	private LocalDate dateOfBirth;
}
