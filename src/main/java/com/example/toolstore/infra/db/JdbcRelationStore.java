package com.example.toolstore.infra.db;

import com.example.toolstore.core.config.ToolStoreProperties;
import com.example.toolstore.core.error.RelationStoreException;
import com.example.toolstore.core.paging.PageRequest;
import com.example.toolstore.core.relation.ColumnDefinition;
import com.example.toolstore.core.relation.RelationDefinition;
import com.example.toolstore.core.relation.RelationStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** {@link RelationStore} issuing dynamic DDL and DML through {@link JdbcTemplate}. */
@Repository
public class JdbcRelationStore implements RelationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRelationStore.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper om;
    private final SqlDialect dialect;

    @Autowired
    public JdbcRelationStore(JdbcTemplate jdbc, ObjectMapper om, ToolStoreProperties properties) {
        this(jdbc, om, SqlDialect.fromName(properties.store().dialect()));
    }

    JdbcRelationStore(JdbcTemplate jdbc, ObjectMapper om, SqlDialect dialect) {
        this.jdbc = jdbc;
        this.om = om;
        this.dialect = dialect;
    }

    @Override
    public void createIfAbsent(RelationDefinition relation) {
        String columns = relation.columns().stream()
                .map(c -> SqlDialect.quote(c.name()) + " " + dialect.columnDefinition(c.type()))
                .collect(Collectors.joining(", "));
        String ddl = "CREATE TABLE IF NOT EXISTS " + SqlDialect.quote(relation.tableName())
                + " (" + columns + ")";
        log.debug("Creating relation: {}", ddl);
        try {
            jdbc.execute(ddl);
        } catch (DataAccessException e) {
            throw new RelationStoreException("Failed to create table " + relation.tableName(), e);
        }
    }

    @Override
    public void dropIfExists(String tableName) {
        try {
            jdbc.execute("DROP TABLE IF EXISTS " + SqlDialect.quote(tableName));
        } catch (DataAccessException e) {
            throw new RelationStoreException("Failed to drop table " + tableName, e);
        }
    }

    @Override
    public void insert(RelationDefinition relation, ObjectNode values) {
        List<String> names = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        for (ColumnDefinition column : relation.fieldColumns()) {
            if (!values.has(column.name())) {
                continue;
            }
            names.add(SqlDialect.quote(column.name()));
            placeholders.add(dialect.placeholder(column.type()));
            args.add(toSqlValue(column, values.get(column.name())));
        }
        String table = SqlDialect.quote(relation.tableName());
        String sql = names.isEmpty()
                ? "INSERT INTO " + table + " DEFAULT VALUES"
                : "INSERT INTO " + table + " (" + String.join(", ", names) + ") VALUES ("
                        + String.join(", ", placeholders) + ")";
        try {
            jdbc.update(sql, args.toArray());
        } catch (DataAccessException e) {
            throw new RelationStoreException("Failed to insert into " + relation.tableName(), e);
        }
    }

    @Override
    public List<ObjectNode> selectPage(RelationDefinition relation, PageRequest page) {
        String columns = relation.columns().stream()
                .map(c -> SqlDialect.quote(c.name()))
                .collect(Collectors.joining(", "));
        String sql = "SELECT " + columns + " FROM " + SqlDialect.quote(relation.tableName())
                + " ORDER BY " + SqlDialect.quote("id") + " LIMIT ? OFFSET ?";
        try {
            return jdbc.query(sql, recordMapper(relation), page.limit(), page.offset());
        } catch (DataAccessException e) {
            throw new RelationStoreException("Failed to read from " + relation.tableName(), e);
        }
    }

    private RowMapper<ObjectNode> recordMapper(RelationDefinition relation) {
        List<ColumnDefinition> columns = relation.columns();
        return (rs, rowNum) -> {
            ObjectNode record = om.createObjectNode();
            for (int i = 0; i < columns.size(); i++) {
                readColumn(rs, i + 1, columns.get(i), record);
            }
            return record;
        };
    }

    private void readColumn(ResultSet rs, int index, ColumnDefinition column, ObjectNode record)
            throws SQLException {
        String name = column.name();
        switch (column.type()) {
            case IDENTITY, INTEGER -> {
                long value = rs.getLong(index);
                putOrNull(record, name, rs.wasNull(), () -> record.put(name, value));
            }
            case BOOLEAN -> {
                boolean value = rs.getBoolean(index);
                putOrNull(record, name, rs.wasNull(), () -> record.put(name, value));
            }
            case FLOAT -> {
                double value = rs.getDouble(index);
                putOrNull(record, name, rs.wasNull(), () -> record.put(name, value));
            }
            case CREATED_AT -> {
                Timestamp value = rs.getTimestamp(index);
                putOrNull(record, name, value == null,
                        () -> record.put(name, value.toLocalDateTime().toString()));
            }
            case TIMESTAMP -> {
                OffsetDateTime value = rs.getObject(index, OffsetDateTime.class);
                putOrNull(record, name, value == null,
                        () -> record.put(name, value.withOffsetSameInstant(ZoneOffset.UTC).toString()));
            }
            case JSON -> {
                String value = rs.getString(index);
                if (value == null) {
                    record.putNull(name);
                } else {
                    try {
                        record.set(name, om.readTree(value));
                    } catch (JsonProcessingException e) {
                        throw new SQLException("Column " + name + " holds invalid JSON", e);
                    }
                }
            }
            case STRING -> record.put(name, rs.getString(index));
        }
    }

    private static void putOrNull(ObjectNode record, String name, boolean isNull, Runnable put) {
        if (isNull) {
            record.putNull(name);
        } else {
            put.run();
        }
    }

    /**
     * Converts a validated JSON value to a JDBC argument. Unchecked types are converted
     * best-effort; anything the engine rejects surfaces from the insert itself.
     */
    private Object toSqlValue(ColumnDefinition column, JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        return switch (column.type()) {
            case INTEGER -> value.longValue();
            case BOOLEAN -> value.booleanValue();
            case STRING -> value.textValue();
            case FLOAT -> value.isNumber() ? (Object) value.doubleValue() : value.asText();
            case TIMESTAMP -> value.isTextual() ? parseTimestamp(value.textValue()) : value.asText();
            case JSON -> writeJson(value);
            case IDENTITY, CREATED_AT -> throw new IllegalStateException(
                    "Generated column " + column.name() + " cannot be written");
        };
    }

    // bound as OffsetDateTime so the JVM default zone never takes part; no offset means UTC
    private static Object parseTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(text).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException notLocal) {
                // left to the engine, which may accept its own literal formats
                return text;
            }
        }
    }

    private String writeJson(JsonNode value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON value", e);
        }
    }
}
