package com.planchecker.entity.report;

import java.util.List;

import io.quarkus.qute.TemplateData;

/**
 * Abschnitt unterhalb der Plantabelle, z.B. Settings oder Slice-Statistiken.
 *
 * @param alert {@code true}, wenn die Zeilen als Warnung hervorgehoben werden
 */
@TemplateData
public record ReportSection(
		String title,
		List<String> lines,
		boolean alert) {
}
