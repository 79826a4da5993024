package com.example.toolstore.core.error;

public class RelationStoreException extends ToolStoreException {

    private static final long serialVersionUID = 1L;

    public RelationStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.STORE_ERROR;
    }
}
