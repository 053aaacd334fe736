package com.dbmaster.schema;

import com.dbmaster.model.ColumnSchema;
import com.dbmaster.model.ConnectionConfig;
import com.dbmaster.model.ForeignKeySchema;
import com.dbmaster.model.IndexSchema;
import com.dbmaster.model.SchemaPage;
import com.dbmaster.model.TableSchema;
import com.dbmaster.pool.PoolRegistry;
import com.dbmaster.pool.QueryExecutionException;
import com.dbmaster.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads table structure from {@code information_schema} on a single-use connection.
 */
@Slf4j
@Component
public class SchemaSnapshotter {
    public static final int DEFAULT_PAGE_SIZE = 50;

    static final String COUNT_TABLES_SQL =
            "SELECT COUNT(*) AS TABLE_COUNT FROM information_schema.TABLES WHERE TABLE_SCHEMA = ?";

    static final String LIST_TABLES_SQL =
            "SELECT TABLE_NAME, TABLE_TYPE, TABLE_COMMENT FROM information_schema.TABLES "
                    + "WHERE TABLE_SCHEMA = ? ORDER BY TABLE_NAME LIMIT ? OFFSET ?";

    static final String COLUMNS_SQL =
            "SELECT COLUMN_NAME, DATA_TYPE, IS_NULLABLE, COLUMN_KEY, EXTRA, COLUMN_DEFAULT, COLUMN_COMMENT "
                    + "FROM information_schema.COLUMNS WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? "
                    + "ORDER BY ORDINAL_POSITION";

    static final String PRIMARY_KEY_SQL =
            "SELECT COLUMN_NAME FROM information_schema.KEY_COLUMN_USAGE "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND CONSTRAINT_NAME = 'PRIMARY' "
                    + "ORDER BY ORDINAL_POSITION";

    static final String FOREIGN_KEYS_SQL =
            "SELECT CONSTRAINT_NAME, COLUMN_NAME, REFERENCED_TABLE_NAME, REFERENCED_COLUMN_NAME "
                    + "FROM information_schema.KEY_COLUMN_USAGE "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? AND REFERENCED_TABLE_NAME IS NOT NULL";

    static final String INDEXES_SQL =
            "SELECT INDEX_NAME, COLUMN_NAME, NON_UNIQUE, INDEX_TYPE FROM information_schema.STATISTICS "
                    + "WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? ORDER BY INDEX_NAME, SEQ_IN_INDEX";

    private final PoolRegistry poolRegistry;

    public SchemaSnapshotter(PoolRegistry poolRegistry) {
        this.poolRegistry = poolRegistry;
    }

    /**
     * Captures one page of tables. Pages are 1-based; a page past the end is empty.
     */
    public SchemaPage captureSnapshot(ConnectionConfig config, int page, int pageSize) {
        int resolvedPage = Math.max(page, 1);
        int resolvedSize = pageSize > 0 ? pageSize : DEFAULT_PAGE_SIZE;

        Connection conn = poolRegistry.createConnection(config);
        try {
            int totalTables = countTables(conn, config.getDatabase());
            List<TableSchema> tables = readPage(conn, config.getDatabase(), resolvedPage, resolvedSize);
            return new SchemaPage(null, tables, resolvedPage, resolvedSize, totalTables, totalPages(totalTables, resolvedSize));
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to read schema: " + e.getMessage(), e);
        } finally {
            poolRegistry.closeConnection(conn);
        }
    }

    /**
     * Captures every table, walking the pages on one connection.
     *
     * @return tables keyed by name
     */
    public Map<String, TableSchema> captureAll(ConnectionConfig config, int pageSize) {
        int resolvedSize = pageSize > 0 ? pageSize : DEFAULT_PAGE_SIZE;
        long start = System.nanoTime();

        Connection conn = poolRegistry.createConnection(config);
        try {
            int totalTables = countTables(conn, config.getDatabase());
            int pages = totalPages(totalTables, resolvedSize);
            Map<String, TableSchema> tables = new LinkedHashMap<>();
            for (int p = 1; p <= pages; p++) {
                for (TableSchema table : readPage(conn, config.getDatabase(), p, resolvedSize)) {
                    tables.put(table.name(), table);
                }
            }
            log.info("Captured schema: connection_id={}, tables={}, elapsed_ms={}",
                    config.getId(), tables.size(), (System.nanoTime() - start) / 1_000_000L);
            return tables;
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to read schema: " + e.getMessage(), e);
        } finally {
            poolRegistry.closeConnection(conn);
        }
    }

    private int countTables(Connection conn, String database) throws SQLException {
        List<Map<String, Object>> rows = query(conn, COUNT_TABLES_SQL, database);
        if (rows.isEmpty()) {
            return 0;
        }
        Object count = rows.get(0).get("TABLE_COUNT");
        return count instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(count));
    }

    private List<TableSchema> readPage(Connection conn, String database, int page, int pageSize) throws SQLException {
        List<Map<String, Object>> tableRows = query(conn, LIST_TABLES_SQL, database, pageSize, (page - 1) * pageSize);
        List<TableSchema> tables = new ArrayList<>(tableRows.size());
        for (Map<String, Object> tableRow : tableRows) {
            String tableName = text(tableRow.get("TABLE_NAME"));
            tables.add(toTableSchema(
                    tableRow,
                    query(conn, COLUMNS_SQL, database, tableName),
                    query(conn, PRIMARY_KEY_SQL, database, tableName),
                    query(conn, FOREIGN_KEYS_SQL, database, tableName),
                    query(conn, INDEXES_SQL, database, tableName)));
        }
        return tables;
    }

    /**
     * Assembles one table from the raw catalog rows. Index rows must arrive ordered by index name
     * and sequence; they are grouped by name keeping that order.
     */
    static TableSchema toTableSchema(
            Map<String, Object> tableRow,
            List<Map<String, Object>> columnRows,
            List<Map<String, Object>> primaryKeyRows,
            List<Map<String, Object>> foreignKeyRows,
            List<Map<String, Object>> indexRows
    ) {
        List<ColumnSchema> columns = new ArrayList<>(columnRows.size());
        for (Map<String, Object> c : columnRows) {
            columns.add(new ColumnSchema(
                    text(c.get("COLUMN_NAME")),
                    text(c.get("DATA_TYPE")),
                    "YES".equalsIgnoreCase(text(c.get("IS_NULLABLE"))),
                    text(c.get("COLUMN_DEFAULT")),
                    text(c.get("COLUMN_COMMENT")),
                    text(c.get("EXTRA")),
                    text(c.get("COLUMN_KEY"))));
        }

        List<String> primaryKey = new ArrayList<>(primaryKeyRows.size());
        for (Map<String, Object> pk : primaryKeyRows) {
            primaryKey.add(text(pk.get("COLUMN_NAME")));
        }

        List<ForeignKeySchema> foreignKeys = new ArrayList<>(foreignKeyRows.size());
        for (Map<String, Object> fk : foreignKeyRows) {
            foreignKeys.add(new ForeignKeySchema(
                    text(fk.get("CONSTRAINT_NAME")),
                    text(fk.get("COLUMN_NAME")),
                    text(fk.get("REFERENCED_TABLE_NAME")),
                    text(fk.get("REFERENCED_COLUMN_NAME"))));
        }

        Map<String, IndexBuilder> grouped = new LinkedHashMap<>();
        for (Map<String, Object> idx : indexRows) {
            String name = text(idx.get("INDEX_NAME"));
            IndexBuilder builder = grouped.computeIfAbsent(name,
                    n -> new IndexBuilder(n, isZero(idx.get("NON_UNIQUE")), text(idx.get("INDEX_TYPE"))));
            builder.columns.add(text(idx.get("COLUMN_NAME")));
        }
        List<IndexSchema> indexes = new ArrayList<>(grouped.size());
        for (IndexBuilder b : grouped.values()) {
            indexes.add(new IndexSchema(b.name, b.columns, b.unique, b.type));
        }

        return new TableSchema(
                text(tableRow.get("TABLE_NAME")),
                text(tableRow.get("TABLE_TYPE")),
                text(tableRow.get("TABLE_COMMENT")),
                columns,
                primaryKey,
                foreignKeys,
                indexes);
    }

    private static List<Map<String, Object>> query(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return JdbcJsonSafe.readRows(rs);
            }
        }
    }

    static int totalPages(int totalTables, int pageSize) {
        return totalTables == 0 ? 0 : (totalTables + pageSize - 1) / pageSize;
    }

    private static boolean isZero(Object value) {
        if (value instanceof Number n) {
            return n.intValue() == 0;
        }
        return "0".equals(text(value));
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }

    private static final class IndexBuilder {
        private final String name;
        private final boolean unique;
        private final String type;
        private final List<String> columns = new ArrayList<>();

        private IndexBuilder(String name, boolean unique, String type) {
            this.name = name;
            this.unique = unique;
            this.type = type;
        }
    }
}
