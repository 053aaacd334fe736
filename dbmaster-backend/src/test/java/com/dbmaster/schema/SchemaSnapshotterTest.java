package com.dbmaster.schema;

import com.dbmaster.model.ColumnSchema;
import com.dbmaster.model.IndexSchema;
import com.dbmaster.model.TableSchema;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaSnapshotterTest {

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    void mapsCatalogRowsToTableSchema() {
        TableSchema table = SchemaSnapshotter.toTableSchema(
                row("TABLE_NAME", "orders", "TABLE_TYPE", "BASE TABLE", "TABLE_COMMENT", "customer orders"),
                List.of(
                        row("COLUMN_NAME", "id", "DATA_TYPE", "int", "IS_NULLABLE", "NO", "COLUMN_KEY", "PRI",
                                "EXTRA", "auto_increment", "COLUMN_DEFAULT", null, "COLUMN_COMMENT", ""),
                        row("COLUMN_NAME", "note", "DATA_TYPE", "varchar", "IS_NULLABLE", "YES", "COLUMN_KEY", "",
                                "EXTRA", "", "COLUMN_DEFAULT", "n/a", "COLUMN_COMMENT", "free text")),
                List.of(row("COLUMN_NAME", "id")),
                List.of(row("CONSTRAINT_NAME", "fk_user", "COLUMN_NAME", "user_id",
                        "REFERENCED_TABLE_NAME", "users", "REFERENCED_COLUMN_NAME", "id")),
                List.of());

        assertThat(table.name()).isEqualTo("orders");
        assertThat(table.type()).isEqualTo("BASE TABLE");
        assertThat(table.comment()).isEqualTo("customer orders");
        assertThat(table.primaryKey()).containsExactly("id");
        assertThat(table.columns()).containsExactly(
                new ColumnSchema("id", "int", false, null, "", "auto_increment", "PRI"),
                new ColumnSchema("note", "varchar", true, "n/a", "free text", "", ""));
        assertThat(table.foreignKeys()).hasSize(1);
        assertThat(table.foreignKeys().get(0).referenceTable()).isEqualTo("users");
    }

    @Test
    void groupsIndexRowsByNameInSequenceOrder() {
        TableSchema table = SchemaSnapshotter.toTableSchema(
                row("TABLE_NAME", "t", "TABLE_TYPE", "BASE TABLE", "TABLE_COMMENT", ""),
                List.of(), List.of(), List.of(),
                List.of(
                        row("INDEX_NAME", "PRIMARY", "COLUMN_NAME", "id", "NON_UNIQUE", 0, "INDEX_TYPE", "BTREE"),
                        row("INDEX_NAME", "idx_name_city", "COLUMN_NAME", "name", "NON_UNIQUE", 1L, "INDEX_TYPE", "BTREE"),
                        row("INDEX_NAME", "idx_name_city", "COLUMN_NAME", "city", "NON_UNIQUE", 1L, "INDEX_TYPE", "BTREE"),
                        row("INDEX_NAME", "uq_code", "COLUMN_NAME", "code", "NON_UNIQUE", "0", "INDEX_TYPE", "HASH")));

        assertThat(table.indexes()).containsExactly(
                new IndexSchema("PRIMARY", List.of("id"), true, "BTREE"),
                new IndexSchema("idx_name_city", List.of("name", "city"), false, "BTREE"),
                new IndexSchema("uq_code", List.of("code"), true, "HASH"));
    }

    @Test
    void totalPagesRoundsUp() {
        assertThat(SchemaSnapshotter.totalPages(0, 50)).isZero();
        assertThat(SchemaSnapshotter.totalPages(50, 50)).isEqualTo(1);
        assertThat(SchemaSnapshotter.totalPages(51, 50)).isEqualTo(2);
    }
}
