package com.planchecker.entity.report;

import java.util.List;

import io.quarkus.qute.TemplateData;

/**
 * Strukturierte Darstellung eines Plans, unabhängig vom Ausgabeformat.
 *
 * @param analyzed     ob die Zeilenstatistik- und Zeitspalten enthalten sind
 * @param width        Spaltenanzahl jeder Zeile (8 oder 18), entspricht der Anzahl der Spaltennamen
 * @param headerGroups erste Kopfzeile mit Spaltengruppen
 * @param columnNames  zweite Kopfzeile mit den Spaltennamen
 */
@TemplateData
public record Report(
		boolean analyzed,
		int width,
		List<ColumnGroup> headerGroups,
		List<String> columnNames,
		List<ReportRow> rows,
		List<ReportSection> sections) {
}
