package com.planchecker.entity.plan;

/**
 * Benanntes Planfragment unterhalb eines Knotens (SubPlan, InitPlan) oder auf oberster Ebene.
 */
public record SubPlan(
		String name,
		Node topNode) {
}
