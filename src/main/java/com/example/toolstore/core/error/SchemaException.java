package com.example.toolstore.core.error;

public class SchemaException extends ToolStoreException {

    private static final long serialVersionUID = 1L;

    public SchemaException(String message) {
        super(message);
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.SCHEMA_ERROR;
    }
}
