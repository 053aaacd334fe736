package com.dbmaster.model;

import java.util.List;

/**
 * Structural changes of one table present in both snapshots.
 */
public record TableDiff(
        List<ColumnSchema> addedColumns,
        List<ColumnSchema> removedColumns,
        List<MemberChange<ColumnSchema>> modifiedColumns,
        List<IndexSchema> addedIndexes,
        List<IndexSchema> removedIndexes,
        List<MemberChange<IndexSchema>> modifiedIndexes,
        List<ForeignKeySchema> addedForeignKeys,
        List<ForeignKeySchema> removedForeignKeys,
        List<MemberChange<ForeignKeySchema>> modifiedForeignKeys,
        CommentChange commentChanged) {

    public TableDiff {
        addedColumns = List.copyOf(addedColumns);
        removedColumns = List.copyOf(removedColumns);
        modifiedColumns = List.copyOf(modifiedColumns);
        addedIndexes = List.copyOf(addedIndexes);
        removedIndexes = List.copyOf(removedIndexes);
        modifiedIndexes = List.copyOf(modifiedIndexes);
        addedForeignKeys = List.copyOf(addedForeignKeys);
        removedForeignKeys = List.copyOf(removedForeignKeys);
        modifiedForeignKeys = List.copyOf(modifiedForeignKeys);
    }

    public boolean isEmpty() {
        return addedColumns.isEmpty() && removedColumns.isEmpty() && modifiedColumns.isEmpty()
                && addedIndexes.isEmpty() && removedIndexes.isEmpty() && modifiedIndexes.isEmpty()
                && addedForeignKeys.isEmpty() && removedForeignKeys.isEmpty() && modifiedForeignKeys.isEmpty()
                && commentChanged == null;
    }
}
