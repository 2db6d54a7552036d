package com.planchecker.resource;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

/**
 * REST-Resource zum Anzeigen gespeicherter Pläne sowie zum Parsen und Speichern neuer Pläne.
 * Die Endpunkte werden von {@link PlanResourceImpl} implementiert.
 */
@Path("/plan")
public interface PlanResource {

	/**
	 * Lädt einen gespeicherten Plan und liefert den HTML-Report.
	 */
	@GET
	@Path("/{ref}")
	@Produces(MediaType.TEXT_HTML)
	String showPlan(@PathParam("ref") String ref);

	/**
	 * Formular-Post aus dem Browser (Speichern per Ajax oder Parsen aus dem Textfeld).
	 *
	 * @param action   "save" oder "parse"
	 * @param planText Plantext, beim Speichern Base64-kodiert
	 */
	@POST
	@Path("/")
	@Consumes(MediaType.APPLICATION_FORM_URLENCODED)
	Response submitForm(@FormParam("action") String action, @FormParam("plantext") String planText);

	/**
	 * Multipart-Post mit optionalem Datei-Upload; eine hochgeladene Datei hat Vorrang vor dem Textfeld.
	 */
	@POST
	@Path("/")
	@Consumes(MediaType.MULTIPART_FORM_DATA)
	Response submitMultipart(
			@RestForm("action") String action,
			@RestForm("plantext") String planText,
			@RestForm("uploadfile") FileUpload upload);
}
