package com.planchecker.exception;

public class PlanNotFoundException extends PlanCheckerException {

	public PlanNotFoundException(String ref) {
		super("Expected 1 record. Found 0 for ref " + ref);
	}
}
