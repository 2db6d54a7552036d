package com.planchecker.service.check;

import java.util.List;
import java.util.Optional;

import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Warning;

/**
 * Check, der auf jeden einzelnen Knoten angewendet wird.
 */
public abstract class NodeCheck extends PlanCheck {

	protected NodeCheck(String description, List<String> scope, String createdAt) {
		super(description, scope, createdAt);
	}

	public abstract Optional<Warning> check(Node node);
}
