package com.planchecker.entity;

import java.time.LocalDateTime;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Datensatz der plans-Tabelle: ein gespeicherter Plantext unter seiner Referenz.
 * id und createdAt vergibt die Datenbank.
 */
@Getter
@AllArgsConstructor
@ToString(exclude = "text")
public class PlanRecord {

	private final long id;

	private final String ref;

	private final String text;

	private final LocalDateTime createdAt;
}
