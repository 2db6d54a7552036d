package com.planchecker.service.check;

import java.util.ArrayList;
import java.util.List;

import jakarta.inject.Singleton;

import com.planchecker.entity.dto.PlanCheckDTO;
import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.SubPlan;

/**
 * Feste Liste aller Checks. Knoten-Checks laufen über jeden Knoten (inkl. Sub-Plans), Explain-Checks
 * einmal über die gesamte Ausgabe. Gefundene Warnungen werden direkt am Modell ergänzt.
 */
@Singleton
public class PlanCheckRegistry {

	private final List<NodeCheck> nodeChecks;
	private final List<ExplainCheck> explainChecks;

	public PlanCheckRegistry() {
		this(List.of(
				new NestedLoopCheck(),
				new BroadcastMotionCheck(),
				new SeqScanFilterCheck(),
				new ScanSingleRowEstimateCheck(),
				new SpillCheck()),
				List.of(
						new DisabledPlannerSettingCheck(),
						new PlannerFallbackCheck()));
	}

	public PlanCheckRegistry(List<NodeCheck> nodeChecks, List<ExplainCheck> explainChecks) {
		this.nodeChecks = List.copyOf(nodeChecks);
		this.explainChecks = List.copyOf(explainChecks);
	}

	/**
	 * Wendet alle Checks an und hängt die Warnungen an Knoten bzw. Explain an.
	 */
	public void apply(Explain explain) {
		for (SubPlan plan : explain.getPlans()) {
			applyToNode(plan.topNode());
		}
		for (ExplainCheck check : explainChecks) {
			check.check(explain).ifPresent(explain.getWarnings()::add);
		}
	}

	private void applyToNode(Node node) {
		for (NodeCheck check : nodeChecks) {
			check.check(node).ifPresent(node.getWarnings()::add);
		}
		for (Node child : node.getSubNodes()) {
			applyToNode(child);
		}
		for (SubPlan subPlan : node.getSubPlans()) {
			applyToNode(subPlan.topNode());
		}
	}

	/**
	 * Check-Liste für die Startseite, Knoten-Checks zuerst.
	 */
	public List<PlanCheckDTO> describe() {
		List<PlanCheckDTO> checks = new ArrayList<>();
		nodeChecks.forEach(c -> checks.add(c.toDTO()));
		explainChecks.forEach(c -> checks.add(c.toDTO()));
		return checks;
	}
}
