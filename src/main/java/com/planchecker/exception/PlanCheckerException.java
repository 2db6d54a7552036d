package com.planchecker.exception;

/**
 * Gemeinsame Basis aller fachlichen Fehler, die an der Request-Grenze in die Antwort geschrieben werden.
 */
public abstract class PlanCheckerException extends RuntimeException {

	protected PlanCheckerException(String message) {
		super(message);
	}

	protected PlanCheckerException(String message, Throwable cause) {
		super(message, cause);
	}
}
