package com.planchecker.entity.plan;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * Vollständig eingelesene EXPLAIN-Ausgabe: Planbäume sowie die nachgestellten Abschnitte
 * (Slice-Statistiken, Speicher, Settings, Optimizer-Status, Laufzeit).
 *
 * <p>{@code memoryUsed}, {@code memoryWanted} und {@code runtime} sind 0, wenn der Wert fehlt;
 * {@code optimizerStatus} ist dann leer.
 */
@Getter
@Setter
public class Explain {

	private final List<SubPlan> plans = new ArrayList<>();
	private final List<Warning> warnings = new ArrayList<>();
	private final List<String> sliceStats = new ArrayList<>();
	private final List<Setting> settings = new ArrayList<>();

	private long memoryUsed;
	private long memoryWanted;
	private String optimizerStatus = "";
	private double runtime;

	/**
	 * Liefert den Wurzelknoten des ersten Plans.
	 */
	public Node firstTopNode() {
		if (plans.isEmpty()) {
			throw new IllegalStateException("Explain contains no plan");
		}
		return plans.get(0).topNode();
	}
}
