package com.planchecker.exception;

/**
 * Der zum Speichern übergebene Plantext ist nicht gültig Base64-kodiert.
 */
public class InvalidPlanEncodingException extends PlanCheckerException {

	public InvalidPlanEncodingException(Throwable cause) {
		super("Plan text is not valid base64", cause);
	}
}
