package com.planchecker.service;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import io.quarkus.qute.Location;
import io.quarkus.qute.Template;

import com.planchecker.entity.dto.PlanCheckDTO;
import com.planchecker.entity.report.Report;

/**
 * Serialisiert einen {@link Report} und die übrigen Seiten über Qute-Templates nach HTML.
 * Werte werden dabei vom Template-Engine HTML-escaped.
 */
@Singleton
public class ReportPageRenderer {

	private final Template planPage;
	private final Template indexPage;
	private final Template parseErrorPage;

	@Inject
	public ReportPageRenderer(
			@Location("plan.html") Template planPage,
			@Location("index.html") Template indexPage,
			@Location("parse-error.html") Template parseErrorPage) {
		this.planPage = planPage;
		this.indexPage = indexPage;
		this.parseErrorPage = parseErrorPage;
	}

	/**
	 * @param planTextBase64 Base64 des Originaltexts, wird beim Speichern zurückgeschickt
	 * @param planRef        Referenz des gespeicherten Plans oder leer, wenn der Plan noch nicht gespeichert ist
	 */
	public String renderPlanPage(Report report, String planTextBase64, String planRef) {
		return planPage
				.data("report", report)
				.data("planText", planTextBase64)
				.data("planRef", planRef == null ? "" : planRef)
				.render();
	}

	public String renderIndexPage(List<PlanCheckDTO> checks) {
		return indexPage.data("checks", checks).render();
	}

	public String renderParseError(String message) {
		return parseErrorPage.data("message", message).render();
	}
}
