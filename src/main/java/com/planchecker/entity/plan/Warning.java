package com.planchecker.entity.plan;

/**
 * Hinweis auf ein mögliches Problem im Plan samt Lösungsvorschlag.
 */
public record Warning(
		String cause,
		String resolution) {
}
