package com.planchecker.exception;

/**
 * Verbindungsaufbau, Abfrage oder Auslesen der plans-Tabelle ist fehlgeschlagen.
 */
public class PlanStoreException extends PlanCheckerException {

	public PlanStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
