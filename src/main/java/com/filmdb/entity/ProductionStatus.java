package com.filmdb.entity;

/**
 * Produktionsphase eines Films.
 */
public enum ProductionStatus {
	PRE_PRODUCTION("Pre-Production"),
	IN_PROGRESS("In Progress"),
	POST_PRODUCTION("Post-Production"),
	RELEASED("Released");

	private final String label;

	ProductionStatus(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}
}
