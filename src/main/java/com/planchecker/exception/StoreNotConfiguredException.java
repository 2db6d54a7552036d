package com.planchecker.exception;

/**
 * Es ist keine Datenbank für gespeicherte Pläne konfiguriert.
 */
public class StoreNotConfiguredException extends PlanCheckerException {

	public StoreNotConfiguredException() {
		super("No database configured");
	}
}
