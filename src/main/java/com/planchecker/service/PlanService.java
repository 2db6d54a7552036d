package com.planchecker.service;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import com.planchecker.entity.PlanRecord;
import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.report.Report;
import com.planchecker.exception.InvalidPlanEncodingException;
import com.planchecker.exception.PlanParseException;
import com.planchecker.repository.PlanRepository;
import com.planchecker.service.check.PlanCheckRegistry;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Verbindet Parser, Checks, Report-Aufbau, HTML-Ausgabe und das Plan-Repository.
 */
@ApplicationScoped
public class PlanService {

	private static final Logger LOG = Logger.getLogger(PlanService.class);

	@Inject
	ExplainParser parser;

	@Inject
	PlanCheckRegistry checkRegistry;

	@Inject
	ReportAssembler assembler;

	@Inject
	ReportPageRenderer pageRenderer;

	@Inject
	PlanRepository repository;

	@Inject
	MeterRegistry meterRegistry;

	/**
	 * Parst den Text und ergänzt die Warnungen aller Checks.
	 */
	public Explain parse(String planText) {
		try {
			Explain explain = parser.parse(planText);
			checkRegistry.apply(explain);
			return explain;
		} catch (PlanParseException e) {
			meterRegistry.counter("planchecker.plans.parse-failures").increment();
			LOG.warnf("Plan could not be parsed: %s", e.getMessage());
			throw e;
		}
	}

	public Report buildReport(String planText) {
		return assembler.build(parse(planText));
	}

	/**
	 * Rendert die vollständige Plan-Seite.
	 *
	 * @param planRef Referenz bei gespeicherten Plänen, sonst leer
	 */
	public String renderPlanPage(String planText, String planRef) {
		Report report = buildReport(planText);
		String encoded = Base64.getEncoder().encodeToString(planText.getBytes(StandardCharsets.UTF_8));
		return pageRenderer.renderPlanPage(report, encoded, planRef);
	}

	public String renderStoredPlan(String ref) {
		PlanRecord record = load(ref);
		return renderPlanPage(record.getText(), record.getRef());
	}

	public String renderParseError(String message) {
		return pageRenderer.renderParseError(message);
	}

	public String renderIndexPage() {
		return pageRenderer.renderIndexPage(checkRegistry.describe());
	}

	/**
	 * Speichert einen Plan, der wie vom Browser gesendet Base64-kodiert vorliegt.
	 */
	public PlanRecord saveEncoded(String planTextBase64) {
		String decoded;
		try {
			byte[] bytes = Base64.getDecoder().decode(planTextBase64 == null ? "" : planTextBase64.trim());
			decoded = new String(bytes, StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			throw new InvalidPlanEncodingException(e);
		}
		return save(decoded);
	}

	public PlanRecord save(String planText) {
		PlanRecord record = repository.insert(planText);
		meterRegistry.counter("planchecker.plans.saved").increment();
		LOG.infof("Saved plan %s (%d characters)", record.getRef(), planText.length());
		return record;
	}

	public PlanRecord load(String ref) {
		return repository.fetchByRef(ref);
	}
}
