package com.dbmaster.schema;

import com.dbmaster.model.ColumnSchema;
import com.dbmaster.model.CommentChange;
import com.dbmaster.model.ForeignKeySchema;
import com.dbmaster.model.IndexSchema;
import com.dbmaster.model.MemberChange;
import com.dbmaster.model.SchemaDiff;
import com.dbmaster.model.SchemaSnapshot;
import com.dbmaster.model.TableDiff;
import com.dbmaster.model.TableSchema;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Computes structural differences between two schema snapshots. Pure and deterministic: the same
 * inputs always produce an equal diff.
 *
 * <p>Columns compare type, nullability, default, comment and extra. Indexes compare uniqueness,
 * type and the set of column names. Foreign keys compare column and referenced table/column.
 * Primary key lists are not compared.
 */
@Component
public class SchemaDiffer {

    public SchemaDiff diff(SchemaSnapshot oldSnapshot, SchemaSnapshot newSnapshot) {
        Map<String, TableSchema> oldTables = oldSnapshot.tables();
        Map<String, TableSchema> newTables = newSnapshot.tables();

        List<String> added = new ArrayList<>();
        for (String name : newTables.keySet()) {
            if (!oldTables.containsKey(name)) {
                added.add(name);
            }
        }
        List<String> removed = new ArrayList<>();
        for (String name : oldTables.keySet()) {
            if (!newTables.containsKey(name)) {
                removed.add(name);
            }
        }

        Map<String, TableDiff> modified = new TreeMap<>();
        for (Map.Entry<String, TableSchema> entry : oldTables.entrySet()) {
            TableSchema after = newTables.get(entry.getKey());
            if (after == null) {
                continue;
            }
            TableDiff tableDiff = diffTable(entry.getValue(), after);
            if (!tableDiff.isEmpty()) {
                modified.put(entry.getKey(), tableDiff);
            }
        }

        return new SchemaDiff(oldSnapshot.versionId(), newSnapshot.versionId(), added, removed, modified);
    }

    TableDiff diffTable(TableSchema before, TableSchema after) {
        MemberDiff<ColumnSchema> columns = diffMembers(before.columns(), after.columns(), ColumnSchema::name, SchemaDiffer::columnChanges);
        MemberDiff<IndexSchema> indexes = diffMembers(before.indexes(), after.indexes(), IndexSchema::name, SchemaDiffer::indexChanges);
        MemberDiff<ForeignKeySchema> foreignKeys = diffMembers(before.foreignKeys(), after.foreignKeys(), ForeignKeySchema::name, SchemaDiffer::foreignKeyChanges);

        CommentChange comment = Objects.equals(before.comment(), after.comment())
                ? null
                : new CommentChange(before.comment(), after.comment());

        return new TableDiff(
                columns.added, columns.removed, columns.modified,
                indexes.added, indexes.removed, indexes.modified,
                foreignKeys.added, foreignKeys.removed, foreignKeys.modified,
                comment);
    }

    static List<String> columnChanges(ColumnSchema a, ColumnSchema b) {
        List<String> fields = new ArrayList<>();
        if (!Objects.equals(a.dataType(), b.dataType())) {
            fields.add("type");
        }
        if (a.nullable() != b.nullable()) {
            fields.add("nullable");
        }
        if (!Objects.equals(a.defaultValue(), b.defaultValue())) {
            fields.add("default");
        }
        if (!Objects.equals(a.comment(), b.comment())) {
            fields.add("comment");
        }
        if (!Objects.equals(a.extra(), b.extra())) {
            fields.add("extra");
        }
        return fields;
    }

    static List<String> indexChanges(IndexSchema a, IndexSchema b) {
        List<String> fields = new ArrayList<>();
        if (a.unique() != b.unique()) {
            fields.add("unique");
        }
        if (!Objects.equals(a.type(), b.type())) {
            fields.add("type");
        }
        if (!new TreeSet<>(a.columns()).equals(new TreeSet<>(b.columns()))) {
            fields.add("columns");
        }
        return fields;
    }

    static List<String> foreignKeyChanges(ForeignKeySchema a, ForeignKeySchema b) {
        List<String> fields = new ArrayList<>();
        if (!Objects.equals(a.column(), b.column())) {
            fields.add("column");
        }
        if (!Objects.equals(a.referenceTable(), b.referenceTable())) {
            fields.add("referenceTable");
        }
        if (!Objects.equals(a.referenceColumn(), b.referenceColumn())) {
            fields.add("referenceColumn");
        }
        return fields;
    }

    private static <T> MemberDiff<T> diffMembers(
            List<T> before,
            List<T> after,
            Function<T, String> name,
            BiFunction<T, T, List<String>> compare
    ) {
        // A multi-column foreign key repeats its name; the first entry represents it.
        Map<String, T> oldByName = byName(before, name);
        Map<String, T> newByName = byName(after, name);

        MemberDiff<T> diff = new MemberDiff<>();
        for (Map.Entry<String, T> e : newByName.entrySet()) {
            if (!oldByName.containsKey(e.getKey())) {
                diff.added.add(e.getValue());
            }
        }
        for (Map.Entry<String, T> e : oldByName.entrySet()) {
            T next = newByName.get(e.getKey());
            if (next == null) {
                diff.removed.add(e.getValue());
                continue;
            }
            List<String> changed = compare.apply(e.getValue(), next);
            if (!changed.isEmpty()) {
                diff.modified.add(new MemberChange<>(e.getKey(), e.getValue(), next, changed));
            }
        }
        return diff;
    }

    private static <T> Map<String, T> byName(List<T> members, Function<T, String> name) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T member : members) {
            map.putIfAbsent(name.apply(member), member);
        }
        return map;
    }

    private static final class MemberDiff<T> {
        private final List<T> added = new ArrayList<>();
        private final List<T> removed = new ArrayList<>();
        private final List<MemberChange<T>> modified = new ArrayList<>();
    }
}
