package com.dbmaster.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Declared type of a named query parameter. Values are coerced to the declared type before binding.
 */
public enum ParameterType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE;

    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case NUMBER:
                if (value instanceof Number) {
                    return value;
                }
                try {
                    return new BigDecimal(value.toString().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Not a number: " + value);
                }
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                return Boolean.parseBoolean(value.toString().trim());
            case DATE:
                // Dates travel as ISO strings; the driver accepts java.sql.Date.
                try {
                    return java.sql.Date.valueOf(LocalDate.parse(value.toString().trim()));
                } catch (RuntimeException e) {
                    throw new IllegalArgumentException("Not an ISO date: " + value);
                }
            case STRING:
            default:
                return value.toString();
        }
    }
}
