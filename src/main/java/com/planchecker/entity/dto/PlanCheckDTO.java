package com.planchecker.entity.dto;

import java.util.List;

import io.quarkus.qute.TemplateData;

/**
 * Eintrag der Check-Liste auf der Startseite.
 */
@TemplateData
public record PlanCheckDTO(
		String description,
		List<String> scope,
		String createdAt) {
}
