package com.example.toolstore.core.relation;

import com.example.toolstore.core.config.ToolStoreProperties;
import com.example.toolstore.core.schema.FieldType;
import com.example.toolstore.core.schema.SchemaField;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/** Deterministic, so the write path re-derives the table shape from the registry row. */
@Component
public class TableSynthesizer {

    static final String ID_COLUMN = "id";
    static final String CREATED_AT_COLUMN = "created_at";

    private final String tablePrefix;

    @Autowired
    public TableSynthesizer(ToolStoreProperties properties) {
        this(properties.store().tablePrefix());
    }

    public TableSynthesizer(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public RelationDefinition synthesize(String toolName, List<SchemaField> schema) {
        List<ColumnDefinition> columns = new ArrayList<>(schema.size() + 2);
        columns.add(new ColumnDefinition(ID_COLUMN, ColumnType.IDENTITY, false));
        columns.add(new ColumnDefinition(CREATED_AT_COLUMN, ColumnType.CREATED_AT, false));
        for (SchemaField field : schema) {
            // unknown tags only reach here from rows written outside the validator
            FieldType type = field.fieldType().orElse(FieldType.STRING);
            columns.add(new ColumnDefinition(field.name(), ColumnType.forField(type), true));
        }
        return new RelationDefinition(tableName(toolName), columns);
    }

    public String tableName(String toolName) {
        return tablePrefix + toolName;
    }
}
