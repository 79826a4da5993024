package com.example.toolstore.infra.db;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class ToolRepository {
    private static final String COLUMNS = "id,tool_name,token,schema_json,created_at";

    private final JdbcTemplate jdbc;

    public ToolRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    private static final RowMapper<ToolRow> MAPPER = new RowMapper<>() {
        @Override
        public ToolRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ToolRow(
                    rs.getLong("id"),
                    rs.getString("tool_name"),
                    rs.getString("token"),
                    rs.getString("schema_json"),
                    rs.getTimestamp("created_at").toInstant()
            );
        }
    };

    public List<ToolRow> findAll() {
        return jdbc.query("SELECT " + COLUMNS + " FROM registered_tools ORDER BY tool_name", MAPPER);
    }

    public Optional<ToolRow> findByName(String toolName) {
        List<ToolRow> list = jdbc.query("SELECT " + COLUMNS + " FROM registered_tools WHERE tool_name=?",
                ps -> ps.setString(1, toolName), MAPPER);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    public boolean existsByName(String toolName) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM registered_tools WHERE tool_name=?",
                Integer.class, toolName);
        return count != null && count > 0;
    }

    /**
     * Inserts a registry row and returns a key naming this insert alone, for
     * {@link #deleteInserted}. A concurrent registration of the same name is rejected by the
     * unique constraint with {@link org.springframework.dao.DuplicateKeyException}.
     */
    public String insert(String toolName, String token, String schemaJson, Instant createdAt) {
        String insertKey = UUID.randomUUID().toString();
        jdbc.update("INSERT INTO registered_tools(tool_name, insert_key, token, schema_json, created_at) VALUES (?,?,?,?,?)",
                toolName, insertKey, token, schemaJson, Timestamp.from(createdAt));
        return insertKey;
    }

    public boolean deleteInserted(String toolName, String insertKey) {
        return jdbc.update("DELETE FROM registered_tools WHERE tool_name=? AND insert_key=?", toolName, insertKey) > 0;
    }

    public boolean deleteByName(String toolName) {
        return jdbc.update("DELETE FROM registered_tools WHERE tool_name=?", toolName) > 0;
    }
}
