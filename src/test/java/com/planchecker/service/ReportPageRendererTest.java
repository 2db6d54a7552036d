package com.planchecker.service;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.planchecker.entity.dto.PlanCheckDTO;
import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.report.Report;
import com.planchecker.service.check.PlanCheckRegistry;

import io.quarkus.qute.Engine;
import io.quarkus.qute.ReflectionValueResolver;
import io.quarkus.qute.Template;

/**
 * Rendert die echten Templates mit einer eigenständigen Qute-Engine, ohne Quarkus-Container.
 */
class ReportPageRendererTest {

	private final ExplainParser parser = new ExplainParser();
	private final PlanCheckRegistry checks = new PlanCheckRegistry();
	private final ReportAssembler assembler = new ReportAssembler(new PlanTreeRenderer());

	private ReportPageRenderer renderer;

	@BeforeEach
	void setUp() {
		Engine engine = Engine.builder()
				.addDefaults()
				.addValueResolver(new ReflectionValueResolver())
				.build();
		renderer = new ReportPageRenderer(
				template(engine, "plan.html"),
				template(engine, "index.html"),
				template(engine, "parse-error.html"));
	}

	@Test
	void shouldRenderAnalyzedPlanPage() {
		Explain explain = parser.parse(ExplainParserTest.load("greenplum-analyze.txt"));
		checks.apply(explain);
		Report report = assembler.build(explain);

		String html = renderer.renderPlanPage(report, "U2VxIFNjYW4=", "");

		assertThat(html, containsString("<th colspan=\"4\" class=\"text-center\">Cost</th>"));
		assertThat(html, containsString("<th colspan=\"5\" class=\"text-center\">Time Ms</th>"));
		assertThat(html, containsString("<th>Query Plan:</th>"));
		assertThat(html, containsString("<th class=\"text-right\">Offset</th>"));
		assertThat(html, containsString("Slice 1</span>"));
		assertThat(html, containsString("-> Gather Motion 2:1 (cost=0.00..431.00 rows=1 width=8)"));
		assertThat(html, containsString("<td style=\"padding-left:80px\">"));
		assertThat(html, containsString("<td class=\"text-right\">seg1</td>"));
		assertThat(html, containsString("WARNING: 2 workfiles spilled to disk"));
		assertThat(html, containsString("<strong>Total runtime:</strong>"));
		assertThat(html, containsString("var planTextBase64 = \"U2VxIFNjYW4=\";"));
		assertThat(html, containsString("var planRef = \"\";"));
	}

	@Test
	void shouldRenderSubPlanHeaderAcrossValueColumns() {
		Report report = assembler.build(parser.parse(ExplainParserTest.load("greenplum-estimated.txt")));

		String html = renderer.renderPlanPage(report, "", "Ab12Cd34");

		assertThat(html, containsString("<strong>InitPlan 1</strong></td><td colspan=\"7\"></td>"));
		assertThat(html, not(containsString("Row Stats")));
		assertThat(html, containsString("href=\"/plan/Ab12Cd34\""));
	}

	@Test
	void shouldRenderIndexWithChecks() {
		List<PlanCheckDTO> described = checks.describe();

		String html = renderer.renderIndexPage(described);

		assertThat(html, containsString("enctype=\"multipart/form-data\""));
		assertThat(html, containsString("<td>Check for scans estimating 1 row (missing statistics)</td>"));
		assertThat(html, containsString("<span class=\"badge optimizer-orca\">orca</span>"));
	}

	@Test
	void shouldRenderParseError() {
		String html = renderer.renderParseError("Plan text is empty");

		assertThat(html, containsString("Oops... we had a problem parsing the plan:\n--\nPlan text is empty"));
	}

	private static Template template(Engine engine, String name) {
		try (InputStream in = ReportPageRendererTest.class.getResourceAsStream("/templates/" + name)) {
			if (in == null) {
				throw new IllegalStateException("Missing template " + name);
			}
			return engine.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
