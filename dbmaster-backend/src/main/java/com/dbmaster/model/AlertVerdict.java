package com.dbmaster.model;

/**
 * A positive alert decision. The absence of a verdict means "do not notify".
 */
public record AlertVerdict(AlertConditionType type, AlertCondition condition, String reason) {
}
