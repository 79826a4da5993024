package com.example.toolstore.infra.db;

import com.example.toolstore.core.common.CommonRecord;
import com.example.toolstore.core.paging.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/** Shared {@code multiple_tools} table behind the legacy ingestion path. */
@Repository
public class CommonRecordRepository {
    private static final String COLUMNS = "id,tool_name,data,sensitive,created_at";

    private static final RowMapper<CommonRecord> MAPPER = (rs, rowNum) -> new CommonRecord(
            rs.getLong("id"),
            rs.getString("tool_name"),
            rs.getString("data"),
            rs.getInt("sensitive"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbc;

    public CommonRecordRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(String toolName, String dataJson, int sensitive, Instant createdAt) {
        jdbc.update("INSERT INTO multiple_tools(tool_name, data, sensitive, created_at) VALUES (?,?,?,?)",
                toolName, dataJson, sensitive, Timestamp.from(createdAt));
    }

    public List<CommonRecord> findByToolName(String toolName, boolean includeSensitive, PageRequest page) {
        String sql = "SELECT " + COLUMNS + " FROM multiple_tools WHERE tool_name=?"
                + (includeSensitive ? "" : " AND sensitive=0")
                + " ORDER BY id LIMIT ? OFFSET ?";
        return jdbc.query(sql, MAPPER, toolName, page.limit(), page.offset());
    }
}
