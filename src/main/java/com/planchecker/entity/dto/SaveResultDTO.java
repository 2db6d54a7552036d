package com.planchecker.entity.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Antwort auf das Speichern eines Plans: {"status":"success","ref":...} oder {"status":"failure","msg":...}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SaveResultDTO(
		String status,
		String ref,
		String msg) {

	public static SaveResultDTO success(String ref) {
		return new SaveResultDTO("success", ref, null);
	}

	public static SaveResultDTO failure(String msg) {
		return new SaveResultDTO("failure", null, msg);
	}
}
