package com.planchecker.resource;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Startseite mit Eingabeformular und der Liste aller Checks.
 */
@Path("/")
public interface IndexResource {

	@GET
	@Produces(MediaType.TEXT_HTML)
	String index();
}
