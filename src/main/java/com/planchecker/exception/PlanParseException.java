package com.planchecker.exception;

/**
 * Der übergebene Text lässt sich nicht als EXPLAIN-Ausgabe interpretieren.
 */
public class PlanParseException extends PlanCheckerException {

	private final int lineNumber;

	public PlanParseException(String message) {
		this(message, 0);
	}

	public PlanParseException(String message, int lineNumber) {
		super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message);
		this.lineNumber = lineNumber;
	}

	public PlanParseException(String message, int lineNumber, Throwable cause) {
		super(lineNumber > 0 ? message + " (line " + lineNumber + ")" : message, cause);
		this.lineNumber = lineNumber;
	}

	/**
	 * Zeilennummer (1-basiert) des fehlerhaften Eintrags oder 0, wenn sich der Fehler auf den gesamten Text bezieht.
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
