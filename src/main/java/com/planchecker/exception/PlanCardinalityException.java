package com.planchecker.exception;

/**
 * Eine Referenz liefert mehr als einen Datensatz. Tritt nur bei Kollisionen der Zufallsreferenzen auf.
 */
public class PlanCardinalityException extends PlanCheckerException {

	private final int count;

	public PlanCardinalityException(String ref, int count) {
		super("Expected 1 record. Found " + count + " for ref " + ref);
		this.count = count;
	}

	public int getCount() {
		return count;
	}
}
