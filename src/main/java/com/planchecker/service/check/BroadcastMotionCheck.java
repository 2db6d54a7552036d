package com.planchecker.service.check;

import java.util.List;
import java.util.Optional;

import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Warning;

/**
 * Meldet Broadcast Motions mit hoher Zeilenschätzung; die Daten werden dabei an jedes Segment kopiert.
 */
public class BroadcastMotionCheck extends NodeCheck {

	static final long ROW_THRESHOLD = 10_000;

	public BroadcastMotionCheck() {
		super("Check for \"Broadcast Motion\" with more than " + ROW_THRESHOLD + " estimated rows",
				List.of(LEGACY, ORCA), "2016-04-14");
	}

	@Override
	public Optional<Warning> check(Node node) {
		if (node.getOperator() == null || !node.getOperator().startsWith("Broadcast Motion")
				|| node.getRows() <= ROW_THRESHOLD) {
			return Optional.empty();
		}
		return Optional.of(new Warning("Broadcast Motion of " + node.getRows() + " rows",
				"Check the table statistics are current (ANALYZE) or distribute the tables on the join key"));
	}
}
