package com.planchecker.entity.report;

import java.util.List;

import io.quarkus.qute.TemplateData;

/**
 * Inhalt der Beschreibungszelle eines Knotens.
 *
 * @param slice    Slice-Nummer für das Badge oder {@code null}, wenn der Knoten keinem Slice zugeordnet ist
 * @param summary  Zusammenfassung mit Operator, Kosten, Zeilen und Breite
 * @param details  Extra-Info-Zeilen ohne die Knotenzeile selbst
 * @param warnings Warnungen im Format "WARNING: Ursache | Lösung"
 */
@TemplateData
public record NodeDescription(
		Integer slice,
		String summary,
		List<String> details,
		List<String> warnings) {

	public boolean hasSlice() {
		return slice != null;
	}
}
