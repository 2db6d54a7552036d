package com.planchecker.entity.plan;

public record Setting(
		String name,
		String value) {
}
