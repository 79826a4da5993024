package com.example.toolstore.core.registry;

import com.example.toolstore.core.error.RelationStoreException;
import com.example.toolstore.core.error.ToolConflictException;
import com.example.toolstore.core.error.ToolNotFoundException;
import com.example.toolstore.core.schema.SchemaField;
import com.example.toolstore.infra.db.ToolRepository;
import com.example.toolstore.infra.db.ToolRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Nothing is cached, so a deregistration is visible to the next request.
 */
@Component
public class ToolRegistry {
    private static final TypeReference<List<SchemaField>> SCHEMA_TYPE = new TypeReference<>() {};

    private final ToolRepository repo;
    private final ObjectMapper om;

    public ToolRegistry(ToolRepository repo, ObjectMapper om) {
        this.repo = repo;
        this.om = om;
    }

    public List<Map<String, Object>> list() {
        List<Map<String, Object>> res = new ArrayList<>();
        for (ToolRow row : repo.findAll()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("tool_name", row.toolName());
            m.put("schema", readSchema(row));
            m.put("created_at", row.createdAt().toString());
            res.add(m);
        }
        return res;
    }

    // exact match, no case folding
    public Optional<ToolRegistration> lookup(String toolName) {
        return repo.findByName(toolName).map(this::toRegistration);
    }

    public ToolRegistration require(String toolName) {
        return lookup(toolName).orElseThrow(() -> new ToolNotFoundException("Tool not found: " + toolName));
    }

    public boolean exists(String toolName) {
        return repo.existsByName(toolName);
    }

    /**
     * Writes the registry row, joining the caller's transaction if there is one.
     *
     * @return a key that {@link #discard} accepts to remove exactly this row
     * @throws ToolConflictException if the name is already taken, including by a concurrent
     *     registration that committed first
     */
    public String register(ToolRegistration registration) {
        String schemaJson;
        try {
            schemaJson = om.writeValueAsString(registration.schema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema for " + registration.toolName(), e);
        }
        try {
            return repo.insert(registration.toolName(), registration.token(), schemaJson, registration.createdAt());
        } catch (DuplicateKeyException e) {
            throw new ToolConflictException("Tool already registered: " + registration.toolName());
        }
    }

    public boolean deregister(String toolName) {
        return repo.deleteByName(toolName);
    }

    // leaves a row written by any other registration of the same name alone
    public boolean discard(String toolName, String insertKey) {
        return repo.deleteInserted(toolName, insertKey);
    }

    private ToolRegistration toRegistration(ToolRow row) {
        return new ToolRegistration(row.toolName(), row.token(), readSchema(row), row.createdAt());
    }

    private List<SchemaField> readSchema(ToolRow row) {
        try {
            return om.readValue(row.schemaJson(), SCHEMA_TYPE);
        } catch (JsonProcessingException e) {
            throw new RelationStoreException("Stored schema is unreadable for tool " + row.toolName(), e);
        }
    }
}
