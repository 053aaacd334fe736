package com.dbmaster.scheduler;

import com.dbmaster.model.AlertCondition;
import com.dbmaster.model.AlertConditionType;
import com.dbmaster.model.AlertVerdict;
import com.dbmaster.model.ComparisonOperator;
import com.dbmaster.model.QueryOutcome;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a query outcome should produce a notification.
 *
 * <ul>
 *   <li>A failure always yields an ERROR verdict, whatever the configured conditions.</li>
 *   <li>No configured conditions yields an ALWAYS verdict.</li>
 *   <li>Otherwise the first matching condition wins; no match yields no verdict.</li>
 * </ul>
 */
@Component
public class AlertEvaluator {

    static final String REASON_SUCCESS = "Query executed successfully";
    static final String REASON_NO_RESULTS = "Query returned no results";
    static final String REASON_FAILURE_PREFIX = "Query execution failed: ";

    public Optional<AlertVerdict> evaluate(List<AlertCondition> conditions, QueryOutcome outcome) {
        if (outcome instanceof QueryOutcome.Failure failure) {
            return Optional.of(new AlertVerdict(AlertConditionType.ERROR, new AlertCondition.Error(),
                    REASON_FAILURE_PREFIX + failure.message()));
        }

        List<Map<String, Object>> rows = outcome instanceof QueryOutcome.Rows r ? r.rows() : List.of();

        if (conditions == null || conditions.isEmpty()) {
            return Optional.of(new AlertVerdict(AlertConditionType.ALWAYS, new AlertCondition.Always(), REASON_SUCCESS));
        }

        for (AlertCondition condition : conditions) {
            Optional<AlertVerdict> verdict = check(condition, rows);
            if (verdict.isPresent()) {
                return verdict;
            }
        }
        return Optional.empty();
    }

    private Optional<AlertVerdict> check(AlertCondition condition, List<Map<String, Object>> rows) {
        if (condition instanceof AlertCondition.Always) {
            return Optional.of(new AlertVerdict(AlertConditionType.ALWAYS, condition, REASON_SUCCESS));
        }
        if (condition instanceof AlertCondition.NoResults) {
            return rows.isEmpty()
                    ? Optional.of(new AlertVerdict(AlertConditionType.NO_RESULTS, condition, REASON_NO_RESULTS))
                    : Optional.empty();
        }
        if (condition instanceof AlertCondition.RowsCount rowsCount) {
            if (compare(rows.size(), rowsCount.value(), rowsCount.operator())) {
                String reason = "Row count " + rowsCount.operator().getText() + " " + rowsCount.value().toPlainString();
                return Optional.of(new AlertVerdict(AlertConditionType.ROWS_COUNT, condition, reason));
            }
            return Optional.empty();
        }
        if (condition instanceof AlertCondition.CustomCondition custom) {
            // Existential: one matching row is enough.
            for (Map<String, Object> row : rows) {
                if (compare(row.get(custom.columnName()), custom.value(), custom.operator())) {
                    String reason = "Column '" + custom.columnName() + "' has values "
                            + custom.operator().getText() + " " + custom.value();
                    return Optional.of(new AlertVerdict(AlertConditionType.CUSTOM_CONDITION, condition, reason));
                }
            }
            return Optional.empty();
        }
        // ERROR conditions only fire for failures, handled before the scan.
        return Optional.empty();
    }

    /**
     * Compares {@code actual op expected}. Numeric-looking operands compare as numbers, anything
     * else as strings. A null actual value only satisfies {@code =} against a null expected value
     * and {@code !=} against a non-null one.
     */
    public static boolean compare(Object actual, Object expected, ComparisonOperator operator) {
        if (actual == null || expected == null) {
            boolean bothNull = actual == null && expected == null;
            switch (operator) {
                case EQUAL:
                    return bothNull;
                case NOT_EQUAL:
                    return !bothNull;
                default:
                    return false;
            }
        }

        BigDecimal a = toNumber(actual);
        BigDecimal e = toNumber(expected);
        int cmp;
        if (a != null && e != null) {
            cmp = a.compareTo(e);
        } else {
            cmp = String.valueOf(actual).compareTo(String.valueOf(expected));
        }

        switch (operator) {
            case EQUAL:
                return cmp == 0;
            case NOT_EQUAL:
                return cmp != 0;
            case GREATER_THAN:
                return cmp > 0;
            case LESS_THAN:
                return cmp < 0;
            case GREATER_THAN_OR_EQUAL:
                return cmp >= 0;
            case LESS_THAN_OR_EQUAL:
                return cmp <= 0;
            default:
                return false;
        }
    }

    static BigDecimal toNumber(Object v) {
        if (v instanceof BigDecimal bd) {
            return bd;
        }
        if (v instanceof Number n) {
            try {
                return new BigDecimal(n.toString());
            } catch (NumberFormatException ex) {
                // NaN and infinities
                return null;
            }
        }
        if (v instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
