package com.dbmaster.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators used by alert conditions. Serialized by symbol ({@code ">="}); the enum
 * name is accepted on input as well.
 */
public enum ComparisonOperator {
    EQUAL("=", "equals"),
    NOT_EQUAL("!=", "does not equal"),
    GREATER_THAN(">", "is greater than"),
    LESS_THAN("<", "is less than"),
    GREATER_THAN_OR_EQUAL(">=", "is greater than or equal to"),
    LESS_THAN_OR_EQUAL("<=", "is less than or equal to");

    private final String symbol;
    private final String text;

    ComparisonOperator(String symbol, String text) {
        this.symbol = symbol;
        this.text = text;
    }

    @JsonValue
    public String getSymbol() {
        return symbol;
    }

    public String getText() {
        return text;
    }

    @JsonCreator
    public static ComparisonOperator fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }
}
