package com.planchecker.service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.inject.Singleton;

import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Setting;
import com.planchecker.entity.plan.SubPlan;
import com.planchecker.exception.PlanParseException;

/**
 * Liest die Textausgabe von EXPLAIN bzw. EXPLAIN ANALYZE (Greenplum und PostgreSQL) in ein {@link Explain}.
 *
 * <p>Die Baumstruktur ergibt sich aus der Einrückung: ein Knoten ist Kind des letzten Knotens mit
 * geringerer Einrückung. SubPlan-/InitPlan-Zeilen öffnen einen Sub-Plan, dessen erster Knoten der
 * Wurzelknoten wird. Abschnitte wie "Slice statistics:" oder "Settings:" beenden den Planbaum.
 */
@Singleton
public class ExplainParser {

	static final String TOP_PLAN_NAME = "Plan";

	private static final Pattern NODE_LINE = Pattern.compile(
			"^(?<arrow>->\\s+)?(?<op>.+?)\\s+\\(cost=(?<startup>[\\d.]+)\\.\\.(?<total>[\\d.]+)"
					+ " rows=(?<rows>\\d+) width=(?<width>\\d+)\\)(?<rest>.*)$");
	private static final Pattern SUBPLAN_LINE = Pattern.compile(
			"^(?<name>(?:SubPlan|InitPlan|CTE)\\s+\\S+.*?)(?:\\s+\\(slice(?<slice>\\d+)\\))?$");
	private static final Pattern SLICE = Pattern.compile("\\(slice(\\d+)(?:;[^)]*)?\\)");
	private static final Pattern USING_OBJECT = Pattern.compile("^(?<op>.+?) using (?<object>\\S+) on \\S+.*$");
	private static final Pattern ON_OBJECT = Pattern.compile("^(?<op>.+?) on (?<object>\\S+).*$");
	private static final Pattern ACTUAL = Pattern.compile(
			"\\(actual time=(?<first>[\\d.]+)\\.\\.(?<end>[\\d.]+) rows=(?<rows>\\d+) loops=\\d+\\)");
	private static final Pattern ROWS_OUT_AVG = Pattern.compile(
			"^Rows out:\\s+Avg (?<avg>[\\d.]+) rows x (?<workers>\\d+) workers?(?: at destination)?\\."
					+ "\\s+Max (?<max>[\\d.]+) rows? \\((?<seg>seg-?\\d+)\\)(?<timing>.*)$");
	private static final Pattern ROWS_OUT_SINGLE = Pattern.compile(
			"^Rows out:\\s+(?<rows>[\\d.]+) rows?(?: at destination)?(?: \\((?<seg>seg-?\\d+)\\))?(?<timing>.*)$");
	private static final Pattern MS_FIRST = Pattern.compile("([\\d.]+) ms to first row");
	private static final Pattern MS_END = Pattern.compile("([\\d.]+) ms to end");
	private static final Pattern MS_OFFSET = Pattern.compile("start offset by ([\\d.]+) ms");
	private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");
	private static final Pattern ROW_COUNT_FOOTER = Pattern.compile("^\\(\\d+ rows?\\)$");

	private enum Trailer {
		NONE,
		SLICE_STATISTICS,
		STATEMENT_STATISTICS
	}

	/**
	 * Stack-Eintrag: entweder ein Knoten oder ein Sub-Plan, der noch auf seinen Wurzelknoten wartet.
	 */
	private static final class Frame {
		final int indent;
		final Node node;
		final Node subPlanParent;
		final String subPlanName;
		final int subPlanSlice;
		boolean resolved;

		private Frame(int indent, Node node, Node subPlanParent, String subPlanName, int subPlanSlice) {
			this.indent = indent;
			this.node = node;
			this.subPlanParent = subPlanParent;
			this.subPlanName = subPlanName;
			this.subPlanSlice = subPlanSlice;
		}

		static Frame node(int indent, Node node) {
			return new Frame(indent, node, null, null, Node.NO_SLICE);
		}

		static Frame subPlan(int indent, Node parent, String name, int slice) {
			return new Frame(indent, null, parent, name, slice);
		}

		boolean isSubPlan() {
			return subPlanName != null;
		}
	}

	/**
	 * Parst den vollständigen Text.
	 *
	 * @throws PlanParseException wenn kein Planknoten gefunden wird oder die Struktur inkonsistent ist
	 */
	public Explain parse(String text) {
		if (text == null || text.isBlank()) {
			throw new PlanParseException("Plan text is empty");
		}

		Explain explain = new Explain();
		Deque<Frame> stack = new ArrayDeque<>();
		Node lastNode = null;
		int rootIndent = -1;
		boolean inTrailer = false;
		Trailer trailer = Trailer.NONE;

		String[] lines = text.replace("\r", "").split("\n");
		for (int i = 0; i < lines.length; i++) {
			int lineNumber = i + 1;
			String line = lines[i];
			String trimmed = line.trim();
			if (isDecoration(trimmed)) {
				continue;
			}
			int indent = leadingSpaces(line);

			if (inTrailer || (lastNode != null && indent <= rootIndent && isTrailerHeader(trimmed))) {
				inTrailer = true;
				trailer = parseTrailerLine(explain, trimmed, trailer, lineNumber);
				continue;
			}

			Matcher nodeMatcher = NODE_LINE.matcher(trimmed);
			if (nodeMatcher.matches()) {
				Node node = createNode(nodeMatcher, trimmed, lineNumber);
				boolean arrow = nodeMatcher.group("arrow") != null;

				popTo(stack, indent);

				if (stack.isEmpty()) {
					if (arrow && lastNode != null) {
						throw new PlanParseException("Plan node has no parent", lineNumber);
					}
					String name = explain.getPlans().isEmpty() ? TOP_PLAN_NAME
							: TOP_PLAN_NAME + " " + (explain.getPlans().size() + 1);
					explain.getPlans().add(new SubPlan(name, node));
					if (rootIndent < 0) {
						rootIndent = indent;
					}
				} else {
					attach(stack.peek(), node, lineNumber);
				}

				stack.push(Frame.node(indent, node));
				lastNode = node;
				continue;
			}

			if (lastNode == null) {
				// Text vor dem ersten Knoten, z.B. Prompt oder Statement
				continue;
			}

			Matcher subPlanMatcher = SUBPLAN_LINE.matcher(trimmed);
			if (subPlanMatcher.matches()) {
				popTo(stack, indent);
				if (stack.isEmpty() || stack.peek().isSubPlan()) {
					throw new PlanParseException("Sub plan '" + trimmed + "' is not nested under a plan node", lineNumber);
				}
				String slice = subPlanMatcher.group("slice");
				stack.push(Frame.subPlan(indent, stack.peek().node, subPlanMatcher.group("name").trim(),
						slice == null ? Node.NO_SLICE : parseInt(slice, lineNumber)));
				continue;
			}

			if (trimmed.startsWith("Rows out:")) {
				parseRowsOut(lastNode, trimmed, lineNumber);
			}
			lastNode.getExtraInfo().add(trimmed);
		}

		if (explain.getPlans().isEmpty()) {
			throw new PlanParseException("Unable to find any plan nodes in the submitted text");
		}
		popTo(stack, Integer.MIN_VALUE);

		for (SubPlan plan : explain.getPlans()) {
			Node root = plan.topNode();
			computeDerived(root, root.getTotalCost(), root.getMsEnd());
		}
		return explain;
	}

	/**
	 * Entfernt alle Einträge mit mindestens der angegebenen Einrückung.
	 */
	private static void popTo(Deque<Frame> stack, int indent) {
		while (!stack.isEmpty() && stack.peek().indent >= indent) {
			Frame frame = stack.pop();
			if (frame.isSubPlan() && !frame.resolved) {
				throw new PlanParseException("Sub plan '" + frame.subPlanName + "' contains no plan node");
			}
		}
	}

	private void attach(Frame parent, Node node, int lineNumber) {
		if (!parent.isSubPlan()) {
			parent.node.getSubNodes().add(node);
			return;
		}
		if (parent.resolved) {
			throw new PlanParseException("Sub plan '" + parent.subPlanName + "' has more than one top node", lineNumber);
		}
		if (node.getSlice() == Node.NO_SLICE) {
			node.setSlice(parent.subPlanSlice);
		}
		parent.subPlanParent.getSubPlans().add(new SubPlan(parent.subPlanName, node));
		parent.resolved = true;
	}

	private Node createNode(Matcher m, String line, int lineNumber) {
		String op = m.group("op");
		Node node = new Node();

		Matcher slice = SLICE.matcher(op);
		if (slice.find()) {
			node.setSlice(parseInt(slice.group(1), lineNumber));
			op = slice.replaceAll("");
		}
		op = op.replaceAll("\\s{2,}", " ").trim();

		Matcher using = USING_OBJECT.matcher(op);
		Matcher on = ON_OBJECT.matcher(op);
		if (using.matches()) {
			node.setOperator(using.group("op"));
			node.setObject(using.group("object"));
			node.setObjectType("INDEX");
		} else if (on.matches()) {
			node.setOperator(on.group("op"));
			node.setObject(on.group("object"));
			node.setObjectType(objectType(on.group("op")));
		} else {
			node.setOperator(op);
		}

		node.setStartupCost(parseDouble(m.group("startup"), lineNumber));
		node.setTotalCost(parseDouble(m.group("total"), lineNumber));
		node.setRows(parseLong(m.group("rows"), lineNumber));
		node.setWidth(parseLong(m.group("width"), lineNumber));

		String rest = m.group("rest");
		Matcher actual = ACTUAL.matcher(rest);
		if (actual.find()) {
			node.setAnalyzed(true);
			node.setMsFirst(parseDouble(actual.group("first"), lineNumber));
			node.setMsEnd(parseDouble(actual.group("end"), lineNumber));
			node.setActualRows(parseDouble(actual.group("rows"), lineNumber));
		} else if (rest.contains("(never executed)")) {
			node.setAnalyzed(true);
			node.setActualRows(0);
		}

		node.getExtraInfo().add(line);
		return node;
	}

	private static String objectType(String operator) {
		if (operator.contains("Index")) {
			return "INDEX";
		}
		if (operator.contains("Function")) {
			return "FUNCTION";
		}
		return "TABLE";
	}

	private void parseRowsOut(Node node, String line, int lineNumber) {
		String timing;
		Matcher avg = ROWS_OUT_AVG.matcher(line);
		Matcher single = ROWS_OUT_SINGLE.matcher(line);
		if (avg.matches()) {
			node.setAvgRows(parseDouble(avg.group("avg"), lineNumber));
			node.setWorkers(parseInt(avg.group("workers"), lineNumber));
			node.setMaxRows(parseDouble(avg.group("max"), lineNumber));
			node.setMaxSeg(avg.group("seg"));
			timing = avg.group("timing");
		} else if (single.matches()) {
			node.setActualRows(parseDouble(single.group("rows"), lineNumber));
			if (single.group("seg") != null) {
				node.setMaxSeg(single.group("seg"));
			}
			timing = single.group("timing");
		} else {
			// unbekanntes Format, bleibt als Extra-Info stehen
			return;
		}

		node.setAnalyzed(true);
		node.setMsFirst(find(MS_FIRST, timing, lineNumber));
		node.setMsEnd(find(MS_END, timing, lineNumber));
		node.setMsOffset(find(MS_OFFSET, timing, lineNumber));
	}

	private Trailer parseTrailerLine(Explain explain, String line, Trailer current, int lineNumber) {
		String lower = line.toLowerCase(Locale.ROOT);
		if (lower.startsWith("slice statistics:")) {
			return Trailer.SLICE_STATISTICS;
		}
		if (lower.startsWith("statement statistics:")) {
			return Trailer.STATEMENT_STATISTICS;
		}
		if (lower.startsWith("memory used:")) {
			explain.setMemoryUsed((long) find(NUMBER, line, lineNumber));
			return current;
		}
		if (lower.startsWith("memory wanted:")) {
			explain.setMemoryWanted((long) find(NUMBER, line, lineNumber));
			return current;
		}
		if (lower.startsWith("settings:")) {
			parseSettings(explain, afterColon(line));
			return Trailer.NONE;
		}
		if (lower.startsWith("optimizer status:") || lower.startsWith("optimizer:")) {
			explain.setOptimizerStatus(afterColon(line));
			return Trailer.NONE;
		}
		if (lower.startsWith("total runtime:") || lower.startsWith("execution time:")) {
			explain.setRuntime(find(NUMBER, line, lineNumber));
			return Trailer.NONE;
		}
		if (lower.startsWith("planning time:")) {
			return Trailer.NONE;
		}
		if (current == Trailer.SLICE_STATISTICS) {
			explain.getSliceStats().add(line);
		}
		return current;
	}

	private static boolean isTrailerHeader(String line) {
		String lower = line.toLowerCase(Locale.ROOT);
		return lower.startsWith("slice statistics:")
				|| lower.startsWith("statement statistics:")
				|| lower.startsWith("settings:")
				|| lower.startsWith("optimizer status:")
				|| lower.startsWith("optimizer:")
				|| lower.startsWith("total runtime:")
				|| lower.startsWith("execution time:")
				|| lower.startsWith("planning time:")
				|| lower.startsWith("memory used:");
	}

	/**
	 * Greenplum: "enable_nestloop=off; optimizer=on", PostgreSQL: "work_mem = '64MB', enable_seqscan = 'off'".
	 */
	private static void parseSettings(Explain explain, String settings) {
		if (settings.isEmpty()) {
			return;
		}
		String separator = settings.contains(";") ? ";" : ",";
		for (String entry : settings.split(separator)) {
			int eq = entry.indexOf('=');
			if (eq < 0) {
				continue;
			}
			String name = entry.substring(0, eq).trim();
			String value = entry.substring(eq + 1).trim();
			if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
				value = value.substring(1, value.length() - 1);
			}
			if (!name.isEmpty()) {
				explain.getSettings().add(new Setting(name, value));
			}
		}
	}

	/**
	 * Berechnet Eigenkosten und Eigenzeit eines Knotens sowie deren Anteil am Gesamtplan.
	 */
	private void computeDerived(Node node, double planCost, double planMs) {
		double childCost = 0;
		double childEnd = 0;
		for (Node child : node.getSubNodes()) {
			childCost += child.getTotalCost();
			childEnd = Math.max(childEnd, child.getMsEnd());
		}

		node.setNodeCost(Math.max(0, node.getTotalCost() - childCost));
		node.setPrctCost(planCost > 0 ? node.getNodeCost() / planCost * 100 : 0);
		if (node.isAnalyzed()) {
			node.setMsNode(Math.max(0, node.getMsEnd() - childEnd));
			node.setMsPrct(planMs > 0 ? node.getMsNode() / planMs * 100 : 0);
		}

		for (Node child : node.getSubNodes()) {
			computeDerived(child, planCost, planMs);
		}
		for (SubPlan subPlan : node.getSubPlans()) {
			computeDerived(subPlan.topNode(), planCost, planMs);
		}
	}

	private static boolean isDecoration(String trimmed) {
		return trimmed.isEmpty()
				|| trimmed.equals("QUERY PLAN")
				|| trimmed.chars().allMatch(c -> c == '-' || c == '+')
				|| ROW_COUNT_FOOTER.matcher(trimmed).matches();
	}

	private static int leadingSpaces(String line) {
		int count = 0;
		while (count < line.length() && line.charAt(count) == ' ') {
			count++;
		}
		return count;
	}

	private static String afterColon(String line) {
		int colon = line.indexOf(':');
		return colon < 0 ? "" : line.substring(colon + 1).trim();
	}

	private static double find(Pattern pattern, String text, int lineNumber) {
		Matcher m = pattern.matcher(text);
		return m.find() ? parseDouble(m.group(1), lineNumber) : 0;
	}

	private static double parseDouble(String value, int lineNumber) {
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new PlanParseException("Invalid number '" + value + "'", lineNumber, e);
		}
	}

	private static long parseLong(String value, int lineNumber) {
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new PlanParseException("Invalid number '" + value + "'", lineNumber, e);
		}
	}

	private static int parseInt(String value, int lineNumber) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new PlanParseException("Invalid number '" + value + "'", lineNumber, e);
		}
	}
}
