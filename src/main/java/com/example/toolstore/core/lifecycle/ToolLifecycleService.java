package com.example.toolstore.core.lifecycle;

import com.example.toolstore.core.auth.AccessPolicy;
import com.example.toolstore.core.config.ToolStoreProperties;
import com.example.toolstore.core.error.RelationStoreException;
import com.example.toolstore.core.error.ToolConflictException;
import com.example.toolstore.core.error.ToolNotFoundException;
import com.example.toolstore.core.paging.PageRequest;
import com.example.toolstore.core.registry.ToolRegistration;
import com.example.toolstore.core.registry.ToolRegistry;
import com.example.toolstore.core.relation.RelationDefinition;
import com.example.toolstore.core.relation.RelationStore;
import com.example.toolstore.core.relation.TableSynthesizer;
import com.example.toolstore.core.schema.PayloadValidator;
import com.example.toolstore.core.schema.SchemaField;
import com.example.toolstore.core.schema.SchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A tool table exists iff its registry row does. Registration writes the row and creates the
 * table in one transaction; deregistration drops the table before removing the row, and only
 * lenient deregistration removes the row after a failed drop.
 */
@Service
public class ToolLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ToolLifecycleService.class);

    private final SchemaValidator schemaValidator;
    private final PayloadValidator payloadValidator;
    private final TableSynthesizer synthesizer;
    private final ToolRegistry registry;
    private final RelationStore relationStore;
    private final AccessPolicy accessPolicy;
    private final TransactionTemplate transactions;
    private final Clock clock;
    private final boolean lenientDeregistration;

    public ToolLifecycleService(
            SchemaValidator schemaValidator,
            PayloadValidator payloadValidator,
            TableSynthesizer synthesizer,
            ToolRegistry registry,
            RelationStore relationStore,
            AccessPolicy accessPolicy,
            TransactionTemplate transactions,
            Clock clock,
            ToolStoreProperties properties) {
        this.schemaValidator = schemaValidator;
        this.payloadValidator = payloadValidator;
        this.synthesizer = synthesizer;
        this.registry = registry;
        this.relationStore = relationStore;
        this.accessPolicy = accessPolicy;
        this.transactions = transactions;
        this.clock = clock;
        this.lenientDeregistration = properties.lifecycle().lenientDeregistration();
    }

    public ToolRegistration register(String toolName, String token, JsonNode schema, String adminCredential) {
        accessPolicy.requireAdmin(adminCredential);
        schemaValidator.validateToolName(toolName);
        List<SchemaField> fields = schemaValidator.validate(schema);
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Tool token must not be blank");
        }
        if (registry.exists(toolName)) {
            throw new ToolConflictException("Tool already registered: " + toolName);
        }

        RelationDefinition relation = synthesizer.synthesize(toolName, fields);
        ToolRegistration registration = new ToolRegistration(toolName, token, fields, clock.instant());
        AtomicReference<String> insertKey = new AtomicReference<>();
        try {
            transactions.executeWithoutResult(status -> {
                insertKey.set(registry.register(registration));
                relationStore.createIfAbsent(relation);
            });
        } catch (RelationStoreException e) {
            // some engines commit the open transaction on DDL, so the row may already be durable;
            // only this call's row is removed, a concurrent registrant may own the name by now
            try {
                if (insertKey.get() != null) {
                    registry.discard(toolName, insertKey.get());
                }
            } catch (DataAccessException cleanup) {
                e.addSuppressed(cleanup);
            }
            log.error("Registration of tool {} rolled back: table {} could not be created",
                    toolName, relation.tableName(), e);
            throw e;
        }
        log.info("Registered tool {} with {} field(s) in table {}", toolName, fields.size(), relation.tableName());
        return registration;
    }

    public void store(String toolName, String token, JsonNode payload) {
        ToolRegistration registration = registry.require(toolName);
        accessPolicy.requireToolToken(registration, token);
        payloadValidator.validate(payload, registration.schema());

        ObjectNode values = payloadValidator.retainKnownFields(payload, registration.schema());
        RelationDefinition relation = synthesizer.synthesize(toolName, registration.schema());
        try {
            relationStore.insert(relation, values);
        } catch (RelationStoreException e) {
            throw vanishedOr(toolName, e);
        }
        log.debug("Stored record for tool {} ({} field(s))", toolName, values.size());
    }

    public List<ObjectNode> read(String toolName, PageRequest page) {
        ToolRegistration registration = registry.require(toolName);
        RelationDefinition relation = synthesizer.synthesize(toolName, registration.schema());
        try {
            return relationStore.selectPage(relation, page);
        } catch (RelationStoreException e) {
            throw vanishedOr(toolName, e);
        }
    }

    public void deregister(String toolName, String adminCredential) {
        accessPolicy.requireAdmin(adminCredential);
        registry.require(toolName);

        String table = synthesizer.tableName(toolName);
        try {
            relationStore.dropIfExists(table);
        } catch (RelationStoreException e) {
            if (!lenientDeregistration) {
                log.error("Deregistration of tool {} aborted: table {} could not be dropped", toolName, table, e);
                throw e;
            }
            log.warn("Dropping table {} failed; removing registry row for {} anyway, table is orphaned",
                    table, toolName, e);
        }
        registry.deregister(toolName);
        log.info("Deregistered tool {}", toolName);
    }

    public List<SchemaField> describe(String toolName) {
        return registry.require(toolName).schema();
    }

    // a deregistration may have dropped the table under us
    private RuntimeException vanishedOr(String toolName, RelationStoreException e) {
        if (!registry.exists(toolName)) {
            return new ToolNotFoundException("Tool not found: " + toolName);
        }
        return e;
    }
}
