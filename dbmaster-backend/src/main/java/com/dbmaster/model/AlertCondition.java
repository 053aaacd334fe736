package com.dbmaster.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;

/**
 * A rule evaluated against a query outcome to decide whether to notify. Discriminated by
 * {@code type} in JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AlertCondition.Always.class, name = "ALWAYS"),
        @JsonSubTypes.Type(value = AlertCondition.NoResults.class, name = "NO_RESULTS"),
        @JsonSubTypes.Type(value = AlertCondition.Error.class, name = "ERROR"),
        @JsonSubTypes.Type(value = AlertCondition.RowsCount.class, name = "ROWS_COUNT"),
        @JsonSubTypes.Type(value = AlertCondition.CustomCondition.class, name = "CUSTOM_CONDITION")
})
public interface AlertCondition {

    @JsonIgnore
    AlertConditionType getType();

    record Always() implements AlertCondition {
        @Override
        public AlertConditionType getType() {
            return AlertConditionType.ALWAYS;
        }
    }

    record NoResults() implements AlertCondition {
        @Override
        public AlertConditionType getType() {
            return AlertConditionType.NO_RESULTS;
        }
    }

    record Error() implements AlertCondition {
        @Override
        public AlertConditionType getType() {
            return AlertConditionType.ERROR;
        }
    }

    record RowsCount(ComparisonOperator operator, BigDecimal value) implements AlertCondition {
        public RowsCount {
            if (operator == null) {
                throw new IllegalArgumentException("ROWS_COUNT requires an operator");
            }
            if (value == null) {
                throw new IllegalArgumentException("ROWS_COUNT requires a numeric value");
            }
        }

        @Override
        public AlertConditionType getType() {
            return AlertConditionType.ROWS_COUNT;
        }
    }

    /**
     * Matches when at least one result row's {@code columnName} value satisfies the comparison.
     */
    record CustomCondition(String columnName, ComparisonOperator operator, String value) implements AlertCondition {
        public CustomCondition {
            if (columnName == null || columnName.isBlank()) {
                throw new IllegalArgumentException("CUSTOM_CONDITION requires a columnName");
            }
            if (operator == null) {
                throw new IllegalArgumentException("CUSTOM_CONDITION requires an operator");
            }
            if (value == null) {
                throw new IllegalArgumentException("CUSTOM_CONDITION requires a value");
            }
        }

        @Override
        public AlertConditionType getType() {
            return AlertConditionType.CUSTOM_CONDITION;
        }
    }
}
