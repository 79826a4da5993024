package com.example.toolstore.core.error;

public enum ErrorCode {
    SCHEMA_ERROR(400, "Schema Error"),
    VALIDATION_ERROR(400, "Validation Error"),
    CONFLICT(400, "Conflict"),
    UNAUTHORIZED(401, "Unauthorized"),
    FORBIDDEN(403, "Forbidden"),
    NOT_FOUND(404, "Not Found"),
    STORE_ERROR(500, "Store Error");

    private final int status;
    private final String title;

    ErrorCode(int status, String title) {
        this.status = status;
        this.title = title;
    }

    public int status() {
        return status;
    }

    public String title() {
        return title;
    }
}
