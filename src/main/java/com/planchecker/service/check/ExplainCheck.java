package com.planchecker.service.check;

import java.util.List;
import java.util.Optional;

import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.plan.Warning;

/**
 * Check, der auf die gesamte EXPLAIN-Ausgabe (Settings, Optimizer-Status, ...) angewendet wird.
 */
public abstract class ExplainCheck extends PlanCheck {

	protected ExplainCheck(String description, List<String> scope, String createdAt) {
		super(description, scope, createdAt);
	}

	public abstract Optional<Warning> check(Explain explain);
}
