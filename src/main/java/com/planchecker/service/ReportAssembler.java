package com.planchecker.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.plan.Setting;
import com.planchecker.entity.plan.SubPlan;
import com.planchecker.entity.plan.Warning;
import com.planchecker.entity.report.ColumnGroup;
import com.planchecker.entity.report.ColumnSchema;
import com.planchecker.entity.report.Report;
import com.planchecker.entity.report.ReportRow;
import com.planchecker.entity.report.ReportSection;

/**
 * Setzt Kopfzeilen, die gerenderten Planbäume und die Abschnitte unterhalb der Tabelle zu einem
 * {@link Report} zusammen. Keine I/O, gleiche Eingabe ergibt denselben Report.
 */
@Singleton
public class ReportAssembler {

	public static final String SECTION_WARNINGS = "Warnings";
	public static final String SECTION_SLICE_STATISTICS = "Slice statistics";
	public static final String SECTION_STATEMENT_STATISTICS = "Statement statistics";
	public static final String SECTION_SETTINGS = "Settings";
	public static final String SECTION_OPTIMIZER_STATUS = "Optimizer status";
	public static final String SECTION_TOTAL_RUNTIME = "Total runtime";

	private static final List<String> ESTIMATED_COLUMNS = List.of(
			"Query Plan:", "Name", "Type", "Startup", "Node", "Prct", "Total", "Rows");
	private static final List<String> ANALYZED_COLUMNS = List.of(
			"Actual", "Avg", "Max", "Seg", "Workers", "First", "Node", "Prct", "End", "Offset");

	private final PlanTreeRenderer renderer;

	@Inject
	public ReportAssembler(PlanTreeRenderer renderer) {
		this.renderer = renderer;
	}

	public Report build(Explain explain) {
		// Das Schema richtet sich ausschließlich nach dem Wurzelknoten des ersten Plans
		ColumnSchema schema = ColumnSchema.of(explain.firstTopNode().isAnalyzed());

		List<ReportRow> rows = new ArrayList<>();
		for (SubPlan plan : explain.getPlans()) {
			rows.addAll(renderer.renderNode(plan.topNode(), 0, schema));
		}

		return new Report(
				schema.isAnalyzed(),
				schema.width(),
				headerGroups(schema),
				columnNames(schema),
				List.copyOf(rows),
				sections(explain));
	}

	static List<ColumnGroup> headerGroups(ColumnSchema schema) {
		List<ColumnGroup> groups = new ArrayList<>();
		groups.add(new ColumnGroup("", 1));
		groups.add(new ColumnGroup("Object", 2));
		groups.add(new ColumnGroup("Cost", 4));
		groups.add(new ColumnGroup("Estimated", 1));
		if (schema.isAnalyzed()) {
			groups.add(new ColumnGroup("Row Stats", 5));
			groups.add(new ColumnGroup("Time Ms", 5));
		}
		return List.copyOf(groups);
	}

	static List<String> columnNames(ColumnSchema schema) {
		if (!schema.isAnalyzed()) {
			return ESTIMATED_COLUMNS;
		}
		List<String> names = new ArrayList<>(ESTIMATED_COLUMNS);
		names.addAll(ANALYZED_COLUMNS);
		return List.copyOf(names);
	}

	private List<ReportSection> sections(Explain explain) {
		List<ReportSection> sections = new ArrayList<>();

		if (!explain.getWarnings().isEmpty()) {
			List<String> lines = new ArrayList<>();
			for (Warning warning : explain.getWarnings()) {
				lines.add(warning.cause() + " | " + warning.resolution());
			}
			sections.add(new ReportSection(SECTION_WARNINGS, List.copyOf(lines), true));
		}

		if (!explain.getSliceStats().isEmpty()) {
			sections.add(new ReportSection(SECTION_SLICE_STATISTICS, List.copyOf(explain.getSliceStats()), false));
		}

		if (explain.getMemoryUsed() > 0) {
			List<String> lines = new ArrayList<>();
			lines.add("Memory used: " + explain.getMemoryUsed());
			if (explain.getMemoryWanted() > 0) {
				lines.add("Memory wanted: " + explain.getMemoryWanted());
			}
			sections.add(new ReportSection(SECTION_STATEMENT_STATISTICS, List.copyOf(lines), false));
		}

		if (!explain.getSettings().isEmpty()) {
			List<String> lines = new ArrayList<>();
			for (Setting setting : explain.getSettings()) {
				lines.add(setting.name() + " = " + setting.value());
			}
			sections.add(new ReportSection(SECTION_SETTINGS, List.copyOf(lines), false));
		}

		if (explain.getOptimizerStatus() != null && !explain.getOptimizerStatus().isEmpty()) {
			sections.add(new ReportSection(SECTION_OPTIMIZER_STATUS, List.of(explain.getOptimizerStatus()), false));
		}

		if (explain.getRuntime() > 0) {
			sections.add(new ReportSection(SECTION_TOTAL_RUNTIME,
					List.of(String.format(Locale.ROOT, "%.0f ms", explain.getRuntime())), false));
		}

		return List.copyOf(sections);
	}
}
