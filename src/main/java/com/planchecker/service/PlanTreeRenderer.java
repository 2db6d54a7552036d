package com.planchecker.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.SubPlan;
import com.planchecker.entity.plan.Warning;
import com.planchecker.entity.report.ColumnSchema;
import com.planchecker.entity.report.NodeDescription;
import com.planchecker.entity.report.ReportRow;

/**
 * Wandelt einen Planknoten samt Nachfahren in eine flache Liste von Tabellenzeilen um.
 *
 * <p>Die Reihenfolge ist depth-first pre-order: erst der Knoten, dann seine Kindknoten, danach je
 * Sub-Plan eine Überschriftszeile gefolgt vom Wurzelknoten des Sub-Plans. Alle Zeilen eines Aufrufs
 * folgen demselben {@link ColumnSchema}.
 */
@Singleton
public class PlanTreeRenderer {

	public static final String PLACEHOLDER = "-";

	static final int DEFAULT_INDENT_DEPTH = 4;
	static final int DEFAULT_INDENT_UNIT = 10;

	private final int indentDepth;
	private final int indentUnit;

	public PlanTreeRenderer() {
		this(DEFAULT_INDENT_DEPTH, DEFAULT_INDENT_UNIT);
	}

	@Inject
	public PlanTreeRenderer(
			@ConfigProperty(name = "planchecker.render.indent-depth", defaultValue = "4") int indentDepth,
			@ConfigProperty(name = "planchecker.render.indent-unit", defaultValue = "10") int indentUnit) {
		if (indentDepth < 1 || indentUnit < 1) {
			throw new IllegalArgumentException("Indent depth and unit must be positive");
		}
		this.indentDepth = indentDepth;
		this.indentUnit = indentUnit;
	}

	/**
	 * Rendert einen Teilbaum; das Schema ergibt sich aus {@link Node#isAnalyzed()} des übergebenen Knotens.
	 */
	public List<ReportRow> renderNode(Node node, int depth) {
		return renderNode(node, depth, ColumnSchema.of(node.isAnalyzed()));
	}

	/**
	 * Rendert einen Teilbaum mit vorgegebenem Schema.
	 *
	 * @param depth Tiefe des Elternelements; der Knoten selbst landet auf {@code depth + 1}
	 */
	public List<ReportRow> renderNode(Node node, int depth, ColumnSchema schema) {
		List<ReportRow> rows = new ArrayList<>();
		appendNode(rows, node, depth, schema);
		return rows;
	}

	/**
	 * Linker Einzug in Pixeln für eine Ebene.
	 */
	public int indent(int level) {
		return level * indentDepth * indentUnit;
	}

	private void appendNode(List<ReportRow> rows, Node node, int depth, ColumnSchema schema) {
		int level = depth + 1;
		rows.add(ReportRow.node(level, indent(level), describe(node), values(node, schema)));

		for (Node child : node.getSubNodes()) {
			appendNode(rows, child, level, schema);
		}
		for (SubPlan subPlan : node.getSubPlans()) {
			appendSubPlan(rows, subPlan, level, schema);
		}
	}

	private void appendSubPlan(List<ReportRow> rows, SubPlan subPlan, int depth, ColumnSchema schema) {
		int level = depth + 1;
		rows.add(ReportRow.subPlan(level, indent(level), subPlan.name(), schema.width() - 1));
		appendNode(rows, subPlan.topNode(), level, schema);
	}

	private NodeDescription describe(Node node) {
		Integer slice = node.getSlice() > Node.NO_SLICE ? node.getSlice() : null;
		String summary = format("-> %s (cost=%.2f..%.2f rows=%d width=%d)",
				node.getOperator(),
				node.getStartupCost(),
				node.getTotalCost(),
				node.getRows(),
				node.getWidth());

		List<String> details = new ArrayList<>();
		List<String> extraInfo = node.getExtraInfo();
		for (int i = 1; i < extraInfo.size(); i++) {
			details.add(extraInfo.get(i).trim());
		}

		List<String> warnings = new ArrayList<>();
		for (Warning warning : node.getWarnings()) {
			warnings.add("WARNING: " + warning.cause() + " | " + warning.resolution());
		}
		return new NodeDescription(slice, summary, List.copyOf(details), List.copyOf(warnings));
	}

	private List<String> values(Node node, ColumnSchema schema) {
		List<String> values = new ArrayList<>(schema.width() - 1);
		values.add(nullToEmpty(node.getObject()));
		values.add(nullToEmpty(node.getObjectType()));
		values.add(format("%.0f", node.getStartupCost()));
		values.add(format("%.0f", node.getNodeCost()));
		values.add(format("%.0f%%", node.getPrctCost()));
		values.add(format("%.0f", node.getTotalCost()));
		values.add(Long.toString(node.getRows()));

		if (!schema.isAnalyzed()) {
			return values;
		}

		if (!node.isAnalyzed()) {
			// Knoten ohne Laufzeitdaten in einem analysierten Report
			while (values.size() < schema.width() - 1) {
				values.add(PLACEHOLDER);
			}
			return values;
		}

		if (node.getActualRows() > Node.NOT_REPORTED) {
			values.add(format("%.0f", node.getActualRows()));
			values.add(PLACEHOLDER);
			values.add(PLACEHOLDER);
			values.add(segment(node));
			values.add(PLACEHOLDER);
		} else {
			values.add(PLACEHOLDER);
			values.add(format("%.0f", node.getAvgRows()));
			values.add(format("%.0f", node.getMaxRows()));
			values.add(segment(node));
			values.add(Integer.toString(node.getWorkers()));
		}

		values.add(format("%.0f", node.getMsFirst()));
		values.add(format("%.0f", node.getMsNode()));
		values.add(format("%.0f%%", node.getMsPrct()));
		values.add(format("%.0f", node.getMsEnd()));
		values.add(format("%.0f", node.getMsOffset()));
		return values;
	}

	private static String segment(Node node) {
		String seg = node.getMaxSeg();
		return seg == null || seg.isBlank() ? PLACEHOLDER : seg;
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}

	private static String format(String pattern, Object... args) {
		return String.format(Locale.ROOT, pattern, args);
	}
}
