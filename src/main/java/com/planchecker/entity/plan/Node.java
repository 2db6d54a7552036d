package com.planchecker.entity.plan;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

/**
 * Ein Operator innerhalb eines Ausführungsplans mit geschätzten und, bei EXPLAIN ANALYZE, tatsächlichen
 * Kennzahlen.
 *
 * <p>Nicht vorhandene Werte werden über Sentinels abgebildet: {@code slice = -1} bedeutet "kein Slice",
 * {@code actualRows = -1} bedeutet, dass der Knoten keine einzelne Zeilenzahl gemeldet hat.
 */
@Getter
@Setter
public class Node {

	public static final int NO_SLICE = -1;
	public static final double NOT_REPORTED = -1;

	private String operator;
	private String object = "";
	private String objectType = "";
	private int slice = NO_SLICE;

	private double startupCost;
	private double totalCost;
	private double nodeCost;
	private double prctCost;
	private long rows;
	private long width;

	private boolean analyzed;
	private double actualRows = NOT_REPORTED;
	private double avgRows;
	private double maxRows;
	private String maxSeg = "";
	private int workers;

	private double msFirst;
	private double msNode;
	private double msPrct;
	private double msEnd;
	private double msOffset;

	/** Erste Zeile ist die Knotenzeile selbst, danach folgen Filter, Sort Keys usw. */
	private final List<String> extraInfo = new ArrayList<>();
	private final List<Warning> warnings = new ArrayList<>();
	private final List<Node> subNodes = new ArrayList<>();
	private final List<SubPlan> subPlans = new ArrayList<>();

	public Node() {
	}

	public Node(String operator) {
		this.operator = operator;
	}
}
