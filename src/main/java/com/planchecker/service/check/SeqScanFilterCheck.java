package com.planchecker.service.check;

import java.util.List;
import java.util.Optional;

import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Warning;

/**
 * Full Scan mit Filter auf großen Tabellen; häufig fehlt ein Index oder eine Partitionierung.
 */
public class SeqScanFilterCheck extends NodeCheck {

	static final long ROW_THRESHOLD = 100_000;

	public SeqScanFilterCheck() {
		super("Check for sequential scans with a filter on more than " + ROW_THRESHOLD + " estimated rows",
				List.of(LEGACY, ORCA), "2016-04-25");
	}

	@Override
	public Optional<Warning> check(Node node) {
		String operator = node.getOperator();
		if (operator == null || !(operator.contains("Seq Scan") || operator.contains("Table Scan"))
				|| node.getRows() <= ROW_THRESHOLD || !hasFilter(node)) {
			return Optional.empty();
		}
		return Optional.of(new Warning("Filtered scan of " + node.getRows() + " rows on " + node.getObject(),
				"Consider an index or partitioning on the filter columns"));
	}

	private static boolean hasFilter(Node node) {
		for (String line : node.getExtraInfo()) {
			if (line.startsWith("Filter:")) {
				return true;
			}
		}
		return false;
	}
}
