package com.planchecker.entity.report;

/**
 * Spaltenschema eines Reports. Wird einmal pro Report festgelegt und gilt für alle Zeilen.
 */
public enum ColumnSchema {

	/** Beschreibung, Objekt, Typ, Startup, Node, Prct, Total, Rows */
	ESTIMATED(8),

	/** zusätzlich je fünf Spalten Zeilenstatistik und Zeit */
	ANALYZED(18);

	private final int width;

	ColumnSchema(int width) {
		this.width = width;
	}

	public int width() {
		return width;
	}

	public boolean isAnalyzed() {
		return this == ANALYZED;
	}

	public static ColumnSchema of(boolean analyzed) {
		return analyzed ? ANALYZED : ESTIMATED;
	}
}
