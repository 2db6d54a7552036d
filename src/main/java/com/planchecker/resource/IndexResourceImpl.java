package com.planchecker.resource;

import jakarta.inject.Inject;

import com.planchecker.service.PlanService;

import io.micrometer.core.annotation.Timed;

public class IndexResourceImpl implements IndexResource {

	@Inject
	PlanService planService;

	@Override
	@Timed(value = "planchecker.http.index", description = "Rendern der Startseite")
	public String index() {
		return planService.renderIndexPage();
	}
}
