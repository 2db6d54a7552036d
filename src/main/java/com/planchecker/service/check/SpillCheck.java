package com.planchecker.service.check;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.planchecker.entity.plan.Node;
import com.planchecker.entity.plan.Warning;

/**
 * Erkennt Operatoren, die Workfiles auf Platte geschrieben haben ("Workfile: (2 spilling)").
 */
public class SpillCheck extends NodeCheck {

	private static final Pattern SPILLING = Pattern.compile("\\((\\d{1,9}) spilling");

	public SpillCheck() {
		super("Check for operators spilling to disk", List.of(LEGACY, ORCA), "2016-05-02");
	}

	@Override
	public Optional<Warning> check(Node node) {
		for (String line : node.getExtraInfo()) {
			Matcher m = SPILLING.matcher(line);
			if (m.find() && Integer.parseInt(m.group(1)) > 0) {
				return Optional.of(new Warning(m.group(1) + " workfiles spilled to disk",
						"Increase statement_mem for this query"));
			}
		}
		return Optional.empty();
	}
}
