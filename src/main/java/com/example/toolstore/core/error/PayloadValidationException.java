package com.example.toolstore.core.error;

public class PayloadValidationException extends ToolStoreException {

    private static final long serialVersionUID = 1L;

    public PayloadValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorCode code() {
        return ErrorCode.VALIDATION_ERROR;
    }
}
