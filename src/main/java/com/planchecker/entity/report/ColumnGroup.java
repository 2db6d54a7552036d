package com.planchecker.entity.report;

import io.quarkus.qute.TemplateData;

/**
 * Obergruppe in der ersten Kopfzeile des Reports, z.B. "Cost" über vier Spalten.
 */
@TemplateData
public record ColumnGroup(
		String title,
		int span) {
}
