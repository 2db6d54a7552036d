package com.planchecker.exception;

public class PlanUploadException extends PlanCheckerException {

	public PlanUploadException(String message, Throwable cause) {
		super(message, cause);
	}
}
