package com.example.toolstore.core.error;

public class ToolConflictException extends ToolStoreException {

    private static final long serialVersionUID = 1L;

    public ToolConflictException(String message) {
        super(message);
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.CONFLICT;
    }
}
