package com.planchecker.resource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import jakarta.inject.Inject;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import com.planchecker.entity.dto.SaveResultDTO;
import com.planchecker.exception.PlanCheckerException;
import com.planchecker.exception.PlanParseException;
import com.planchecker.exception.PlanUploadException;
import com.planchecker.service.PlanService;

import io.micrometer.core.annotation.Timed;
import io.smallrye.common.annotation.Blocking;

/**
 * Implementierung der Plan-Endpunkte. Fehler werden nicht weitergereicht, sondern direkt in die Antwort
 * geschrieben: als Text bzw. HTML bei Seiten, als status/msg-JSON beim Speichern.
 */
@Blocking
public class PlanResourceImpl implements PlanResource {

	private static final Logger LOG = Logger.getLogger(PlanResourceImpl.class);

	static final String ACTION_SAVE = "save";
	static final String ACTION_PARSE = "parse";

	static final String UNEXPECTED_PARSE_ERROR = "Oops... we had a problem parsing the plan:\n--\n";

	@Inject
	PlanService planService;

	@Override
	@Timed(value = "planchecker.http.plan.show", description = "Laden und Rendern eines gespeicherten Plans")
	public String showPlan(String ref) {
		try {
			return planService.renderStoredPlan(ref);
		} catch (PlanParseException e) {
			return planService.renderParseError(e.getMessage());
		} catch (PlanCheckerException e) {
			LOG.warnf("Loading plan %s failed: %s", ref, e.getMessage());
			return "Error loading plan from database:\n--\n" + e.getMessage();
		} catch (RuntimeException e) {
			LOG.errorf(e, "Rendering plan %s failed", ref);
			return "Error loading plan from database:\n--\n" + e.getMessage();
		}
	}

	@Override
	@Timed(value = "planchecker.http.plan.submit", description = "Parsen oder Speichern eines Plans aus dem Formular")
	public Response submitForm(String action, String planText) {
		return handle(action, planText);
	}

	@Override
	@Timed(value = "planchecker.http.plan.upload", description = "Parsen oder Speichern eines Plans aus einem Multipart-Formular")
	public Response submitMultipart(String action, String planText, FileUpload upload) {
		String text = planText;
		if (upload != null && upload.fileName() != null && !upload.fileName().isEmpty()) {
			try {
				text = readUpload(upload);
			} catch (PlanUploadException e) {
				LOG.warn(e.getMessage(), e.getCause());
				return html(e.getMessage());
			}
		}
		return handle(action, text);
	}

	private Response handle(String action, String planText) {
		if (ACTION_SAVE.equals(action)) {
			try {
				var record = planService.saveEncoded(planText);
				return Response.ok(SaveResultDTO.success(record.getRef()), MediaType.APPLICATION_JSON).build();
			} catch (PlanCheckerException e) {
				LOG.warnf("Saving plan failed: %s", e.getMessage());
				return Response.ok(SaveResultDTO.failure(e.getMessage()), MediaType.APPLICATION_JSON).build();
			} catch (RuntimeException e) {
				LOG.error("Saving plan failed", e);
				return Response.ok(SaveResultDTO.failure("Saving plan failed: " + e.getMessage()), MediaType.APPLICATION_JSON)
						.build();
			}
		}

		if (ACTION_PARSE.equals(action)) {
			try {
				return html(planService.renderPlanPage(planText == null ? "" : planText, ""));
			} catch (PlanParseException e) {
				return html(planService.renderParseError(e.getMessage()));
			} catch (RuntimeException e) {
				LOG.error("Rendering plan failed", e);
				return html(UNEXPECTED_PARSE_ERROR + e.getMessage());
			}
		}

		return html("Oops... no action specified");
	}

	private static String readUpload(FileUpload upload) {
		try {
			String content = Files.readString(upload.uploadedFile(), StandardCharsets.UTF_8);
			LOG.debugf("Read %d bytes from file upload %s", upload.size(), upload.fileName());
			return content;
		} catch (IOException e) {
			throw new PlanUploadException("Error reading from file upload: " + e.getMessage(), e);
		}
	}

	private static Response html(String body) {
		return Response.ok(body, MediaType.TEXT_HTML_TYPE.withCharset(StandardCharsets.UTF_8.name())).build();
	}
}
