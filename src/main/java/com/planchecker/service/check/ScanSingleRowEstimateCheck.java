package com.planchecker.service.check;

import java.util.List;
import java.util.Optional;

import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Warning;

/**
 * Eine Schätzung von genau einer Zeile auf einem Scan deutet auf fehlende Statistiken hin.
 */
public class ScanSingleRowEstimateCheck extends NodeCheck {

	public ScanSingleRowEstimateCheck() {
		super("Check for scans estimating 1 row (missing statistics)", List.of(LEGACY, ORCA), "2016-04-18");
	}

	@Override
	public Optional<Warning> check(Node node) {
		String operator = node.getOperator();
		if (operator == null || !operator.contains("Scan") || node.getRows() != 1 || "INDEX".equals(node.getObjectType())) {
			return Optional.empty();
		}
		String object = node.getObject() == null || node.getObject().isEmpty() ? "the table" : node.getObject();
		return Optional.of(new Warning("Scan estimates 1 row", "Statistics may be missing, run ANALYZE on " + object));
	}
}
