package com.planchecker.service.check;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.planchecker.entity.plan.Explain;
import com.planchecker.entity.plan.Setting;
import com.planchecker.entity.plan.Warning;

public class DisabledPlannerSettingCheck extends ExplainCheck {

	public DisabledPlannerSettingCheck() {
		super("Check for \"enable_*\" planner settings turned off", List.of(LEGACY), "2016-04-20");
	}

	@Override
	public Optional<Warning> check(Explain explain) {
		List<String> disabled = new ArrayList<>();
		for (Setting setting : explain.getSettings()) {
			if (setting.name().startsWith("enable_") && "off".equalsIgnoreCase(setting.value())) {
				disabled.add(setting.name() + "=off");
			}
		}
		if (disabled.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new Warning("Planner settings disabled: " + String.join(", ", disabled),
				"Verify these settings are intended, they restrict the plans the planner may choose"));
	}
}
