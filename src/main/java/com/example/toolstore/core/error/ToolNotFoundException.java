package com.example.toolstore.core.error;

public class ToolNotFoundException extends ToolStoreException {

    private static final long serialVersionUID = 1L;

    public ToolNotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.NOT_FOUND;
    }
}
