package com.planchecker.service.check;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.plan.Setting;
import com.planchecker.entity.plan.Warning;

/**
 * Meldet, wenn trotz optimizer=on der Legacy-Planner den Plan erzeugt hat.
 */
public class PlannerFallbackCheck extends ExplainCheck {

	public PlannerFallbackCheck() {
		super("Check for fallback to the legacy planner while optimizer=on", List.of(ORCA), "2016-06-01");
	}

	@Override
	public Optional<Warning> check(Explain explain) {
		boolean optimizerOn = false;
		for (Setting setting : explain.getSettings()) {
			if ("optimizer".equals(setting.name()) && "on".equalsIgnoreCase(setting.value())) {
				optimizerOn = true;
			}
		}
		String status = explain.getOptimizerStatus() == null ? "" : explain.getOptimizerStatus().toLowerCase(Locale.ROOT);
		if (!optimizerOn || !(status.contains("legacy") || status.contains("postgres query optimizer"))) {
			return Optional.empty();
		}
		return Optional.of(new Warning("ORCA fell back to the legacy planner",
				"Check the server log for the fallback reason, the query may use an unsupported feature"));
	}
}
