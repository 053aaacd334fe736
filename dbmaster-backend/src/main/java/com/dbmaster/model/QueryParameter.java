package com.dbmaster.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named, typed parameter bound positionally in declaration order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryParameter {
    private String name;
    private ParameterType type;
    private Object value;

    public Object boundValue() {
        ParameterType resolved = type != null ? type : ParameterType.STRING;
        return resolved.coerce(value);
    }
}
