package com.planchecker.service.check;

import java.util.List;
import java.util.Optional;

import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Warning;

public class NestedLoopCheck extends NodeCheck {

	public NestedLoopCheck() {
		super("Check for \"Nested Loop\" joins", List.of(LEGACY, ORCA), "2016-04-14");
	}

	@Override
	public Optional<Warning> check(Node node) {
		if (node.getOperator() == null || !node.getOperator().contains("Nested Loop")) {
			return Optional.empty();
		}
		return Optional.of(new Warning("Nested Loop",
				"Review query for missing join conditions or consider setting enable_nestloop=off"));
	}
}
