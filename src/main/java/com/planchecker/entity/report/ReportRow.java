package com.planchecker.entity.report;

import java.util.List;

import io.quarkus.qute.TemplateData;

/**
 * Eine Zeile der Plantabelle: entweder ein Knoten oder die Überschrift eines Sub-Plans.
 */
@TemplateData
public record ReportRow(
		Kind kind,
		int depth,
		int indent,
		NodeDescription description,
		String label,
		List<String> values,
		int span) {

	public enum Kind {
		NODE,
		SUBPLAN
	}

	public static ReportRow node(int depth, int indent, NodeDescription description, List<String> values) {
		return new ReportRow(Kind.NODE, depth, indent, description, null, List.copyOf(values), 0);
	}

	public static ReportRow subPlan(int depth, int indent, String label, int span) {
		return new ReportRow(Kind.SUBPLAN, depth, indent, null, label, List.of(), span);
	}

	public boolean isSubPlan() {
		return kind == Kind.SUBPLAN;
	}

	/**
	 * Anzahl der Tabellenspalten, die diese Zeile belegt (Beschreibungs- bzw. Label-Zelle eingeschlossen).
	 */
	public int columnCount() {
		return isSubPlan() ? 1 + span : 1 + values.size();
	}
}
