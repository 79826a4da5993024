package com.example.toolstore.core.relation;

import com.example.toolstore.core.error.RelationStoreException;
import com.example.toolstore.core.paging.PageRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Narrow DDL/DML capability over per-tool tables. Every method reports engine failures as
 * {@link RelationStoreException}.
 */
public interface RelationStore {

    void createIfAbsent(RelationDefinition relation);

    void dropIfExists(String tableName);

    /**
     * Inserts one record. {@code values} holds field columns only; absent fields are stored as
     * NULL.
     */
    void insert(RelationDefinition relation, ObjectNode values);

    List<ObjectNode> selectPage(RelationDefinition relation, PageRequest page);
}
