package com.planchecker.service.check;

import java.util.List;

import com.planchecker.entity.dto.PlanCheckDTO;

/**
 * Gemeinsame Beschreibung aller Checks für die Check-Liste auf der Startseite.
 */
public abstract class PlanCheck {

	public static final String LEGACY = "legacy";
	public static final String ORCA = "orca";

	private final String description;
	private final List<String> scope;
	private final String createdAt;

	protected PlanCheck(String description, List<String> scope, String createdAt) {
		this.description = description;
		this.scope = List.copyOf(scope);
		this.createdAt = createdAt;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * Optimizer, für die der Check sinnvoll ist ("legacy", "orca").
	 */
	public List<String> getScope() {
		return scope;
	}

	public String getCreatedAt() {
		return createdAt;
	}

	public PlanCheckDTO toDTO() {
		return new PlanCheckDTO(description, scope, createdAt);
	}
}
