package com.dbmaster.model;

import java.util.List;

/**
 * A column, index or foreign key present on both sides whose compared fields differ.
 *
 * @param <T> member type
 */
public record MemberChange<T>(String name, T before, T after, List<String> changedFields) {
    public MemberChange {
        changedFields = changedFields != null ? List.copyOf(changedFields) : List.of();
    }
}
