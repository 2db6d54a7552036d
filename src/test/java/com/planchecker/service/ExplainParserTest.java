package com.planchecker.service;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Setting;
import com.planchecker.entity.plan.SubPlan;
import com.planchecker.exception.PlanParseException;

class ExplainParserTest {

	private static final double DELTA = 0.0001;

	private final ExplainParser parser = new ExplainParser();

	@Test
	void shouldParseGreenplumAnalyzeTree() {
		Explain explain = parser.parse(load("greenplum-analyze.txt"));

		assertEquals(1, explain.getPlans().size());
		SubPlan plan = explain.getPlans().get(0);
		assertThat(plan.name(), equalTo("Plan"));

		Node gather = plan.topNode();
		assertThat(gather.getOperator(), equalTo("Gather Motion 2:1"));
		assertEquals(1, gather.getSlice());
		assertEquals(431.0, gather.getTotalCost(), DELTA);
		assertEquals(1, gather.getRows());
		assertEquals(8, gather.getWidth());
		assertTrue(gather.isAnalyzed());
		assertEquals(2, gather.getActualRows(), DELTA);
		assertEquals(3.1, gather.getMsFirst(), DELTA);
		assertEquals(5.2, gather.getMsEnd(), DELTA);
		assertEquals(0.5, gather.getMsOffset(), DELTA);

		Node hashJoin = gather.getSubNodes().get(0);
		assertThat(hashJoin.getOperator(), equalTo("Hash Join"));
		assertEquals(Node.NO_SLICE, hashJoin.getSlice());
		assertEquals(Node.NOT_REPORTED, hashJoin.getActualRows(), DELTA);
		assertEquals(1.0, hashJoin.getAvgRows(), DELTA);
		assertEquals(2, hashJoin.getWorkers());
		assertEquals(1.0, hashJoin.getMaxRows(), DELTA);
		assertThat(hashJoin.getMaxSeg(), equalTo("seg0"));
		assertThat(hashJoin.getExtraInfo(), hasItem("Hash Cond: a.id = b.id"));
		assertEquals(2, hashJoin.getSubNodes().size());

		Node scanA = hashJoin.getSubNodes().get(0);
		assertThat(scanA.getOperator(), equalTo("Seq Scan"));
		assertThat(scanA.getObject(), equalTo("a"));
		assertThat(scanA.getObjectType(), equalTo("TABLE"));
		assertThat(scanA.getMaxSeg(), equalTo("seg1"));

		Node hash = hashJoin.getSubNodes().get(1);
		assertThat(hash.getOperator(), equalTo("Hash"));
		assertEquals(0, hash.getMsFirst(), DELTA);
		assertEquals(1.5, hash.getMsEnd(), DELTA);
		assertThat(hash.getSubNodes().get(0).getObject(), equalTo("b"));
	}

	@Test
	void shouldComputeNodeCostAndTimeShares() {
		Node gather = parser.parse(load("greenplum-analyze.txt")).firstTopNode();
		Node hashJoin = gather.getSubNodes().get(0);
		Node scanA = hashJoin.getSubNodes().get(0);

		assertEquals(0, gather.getNodeCost(), DELTA);
		assertEquals(0, gather.getPrctCost(), DELTA);
		assertEquals(231, hashJoin.getNodeCost(), DELTA);
		assertEquals(231.0 / 431.0 * 100, hashJoin.getPrctCost(), DELTA);
		assertEquals(100, scanA.getNodeCost(), DELTA);

		assertEquals(1.2, gather.getMsNode(), DELTA);
		assertEquals(1.2 / 5.2 * 100, gather.getMsPrct(), DELTA);
		// 4.0 ms Ende minus langsamstes Kind (Hash, 1.5 ms)
		assertEquals(2.5, hashJoin.getMsNode(), DELTA);
	}

	@Test
	void shouldParseGreenplumTrailer() {
		Explain explain = parser.parse(load("greenplum-analyze.txt"));

		assertThat(explain.getSliceStats(), contains(
				"(slice0)    Executor memory: 318K bytes.",
				"(slice1)    Executor memory: 4235K bytes avg x 2 workers, 4235K bytes max (seg0)."));
		assertEquals(128000, explain.getMemoryUsed());
		assertEquals(256000, explain.getMemoryWanted());
		assertThat(explain.getSettings(), contains(
				new Setting("enable_nestloop", "off"),
				new Setting("optimizer", "on")));
		assertThat(explain.getOptimizerStatus(), equalTo("legacy query optimizer"));
		assertEquals(6.789, explain.getRuntime(), DELTA);
	}

	@Test
	void shouldParsePostgresAnalyzeWithSubPlan() {
		Explain explain = parser.parse(load("postgres-analyze.txt"));

		Node sort = explain.firstTopNode();
		assertThat(sort.getOperator(), equalTo("Sort"));
		assertTrue(sort.isAnalyzed());
		assertEquals(100, sort.getActualRows(), DELTA);
		assertEquals(0.215, sort.getMsFirst(), DELTA);
		assertEquals(0.221, sort.getMsEnd(), DELTA);
		assertEquals(0.141, sort.getMsNode(), DELTA);
		assertThat(sort.getExtraInfo(), hasItem("Sort Key: t.name"));

		Node index = sort.getSubNodes().get(0);
		assertThat(index.getOperator(), equalTo("Index Scan"));
		assertThat(index.getObject(), equalTo("t_pkey"));
		assertThat(index.getObjectType(), equalTo("INDEX"));

		assertEquals(1, sort.getSubPlans().size());
		SubPlan subPlan = sort.getSubPlans().get(0);
		assertThat(subPlan.name(), equalTo("SubPlan 1"));
		assertThat(subPlan.topNode().getOperator(), equalTo("Result"));
		assertTrue(subPlan.topNode().isAnalyzed());
		assertEquals(0, subPlan.topNode().getActualRows(), DELTA);

		assertThat(explain.getSettings(), contains(
				new Setting("work_mem", "64MB"),
				new Setting("enable_seqscan", "off")));
		assertEquals(0.3, explain.getRuntime(), DELTA);
		assertThat(explain.getSliceStats(), empty());
	}

	@Test
	void shouldParseEstimatedPlanWithInitPlanAndSecondTopLevelPlan() {
		Explain explain = parser.parse(load("greenplum-estimated.txt"));

		assertEquals(2, explain.getPlans().size());
		assertThat(explain.getPlans().get(1).name(), equalTo("Plan 2"));
		assertThat(explain.getPlans().get(1).topNode().getOperator(), equalTo("Result"));

		Node gather = explain.firstTopNode();
		assertFalse(gather.isAnalyzed());
		assertEquals(2, gather.getSlice());

		Node loop = gather.getSubNodes().get(0);
		assertThat(loop.getOperator(), equalTo("Nested Loop"));
		assertEquals(2, loop.getSubNodes().size());
		assertThat(loop.getSubNodes().get(0).getOperator(), equalTo("Broadcast Motion 4:4"));
		assertEquals(20000, loop.getSubNodes().get(0).getRows());

		SubPlan initPlan = loop.getSubPlans().get(0);
		assertThat(initPlan.name(), equalTo("InitPlan 1"));
		assertEquals(3, initPlan.topNode().getSlice());
		Node function = initPlan.topNode().getSubNodes().get(0);
		assertThat(function.getObject(), equalTo("generate_series"));
		assertThat(function.getObjectType(), equalTo("FUNCTION"));

		assertThat(explain.getOptimizerStatus(), equalTo("PQO version 2.55.0"));
	}

	@Test
	void shouldIgnoreWindowsLineEndingsAndLeadingText() {
		String text = "EXPLAIN SELECT 1;\r\n Result  (cost=0.00..0.01 rows=1 width=4)\r\n";

		Explain explain = parser.parse(text);

		assertThat(explain.firstTopNode().getOperator(), equalTo("Result"));
		assertThat(explain.firstTopNode().getExtraInfo().size(), equalTo(1));
	}

	@Test
	void shouldKeepUnknownRowsOutLineAsDetail() {
		String text = "Seq Scan on a  (cost=0.00..1.00 rows=5 width=4)\n  Rows out:  (No row requested) 0 rows\n";

		Node node = parser.parse(text).firstTopNode();

		assertFalse(node.isAnalyzed());
		assertThat(node.getExtraInfo(), hasItem("Rows out:  (No row requested) 0 rows"));
	}

	@Test
	void shouldRejectEmptyText() {
		PlanParseException e = assertThrows(PlanParseException.class, () -> parser.parse("  \n "));
		assertThat(e.getMessage(), equalTo("Plan text is empty"));
	}

	@Test
	void shouldRejectTextWithoutNodes() {
		PlanParseException e = assertThrows(PlanParseException.class, () -> parser.parse("hello\nworld"));
		assertThat(e.getMessage(), equalTo("Unable to find any plan nodes in the submitted text"));
		assertEquals(0, e.getLineNumber());
	}

	@Test
	void shouldRejectArrowNodeWithoutParent() {
		String text = "   Hash  (cost=0.00..1.00 rows=1 width=4)\n ->  Seq Scan on a  (cost=0.00..1.00 rows=1 width=4)\n";

		PlanParseException e = assertThrows(PlanParseException.class, () -> parser.parse(text));

		assertThat(e.getMessage(), containsString("Plan node has no parent"));
		assertEquals(2, e.getLineNumber());
	}

	@Test
	void shouldRejectSubPlanWithoutNode() {
		String text = "Result  (cost=0.00..0.01 rows=1 width=4)\n  SubPlan 1\n";

		PlanParseException e = assertThrows(PlanParseException.class, () -> parser.parse(text));

		assertThat(e.getMessage(), containsString("'SubPlan 1' contains no plan node"));
	}

	@Test
	void shouldRejectSubPlanWithTwoTopNodes() {
		String text = "Result  (cost=0.00..0.01 rows=1 width=4)\n"
				+ "  SubPlan 1\n"
				+ "    ->  Seq Scan on a  (cost=0.00..1.00 rows=1 width=4)\n"
				+ "    ->  Seq Scan on b  (cost=0.00..1.00 rows=1 width=4)\n";

		PlanParseException e = assertThrows(PlanParseException.class, () -> parser.parse(text));

		assertThat(e.getMessage(), containsString("has more than one top node"));
		assertEquals(4, e.getLineNumber());
	}

	@Test
	void shouldRejectInvalidNumber() {
		String text = "Seq Scan on a  (cost=1.2.3..5.00 rows=1 width=4)\n";

		PlanParseException e = assertThrows(PlanParseException.class, () -> parser.parse(text));

		assertThat(e.getMessage(), equalTo("Invalid number '1.2.3' (line 1)"));
		assertTrue(e.getCause() instanceof NumberFormatException);
	}

	static String load(String name) {
		try (InputStream in = ExplainParserTest.class.getResourceAsStream("/plans/" + name)) {
			if (in == null) {
				throw new IllegalStateException("Missing fixture " + name);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
