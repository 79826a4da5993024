package com.example.toolstore.adapter.web;

import com.example.toolstore.core.error.ErrorCode;
import com.example.toolstore.core.error.ToolStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

/**
 * Maps failures to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "title": "Validation Error",
 *   "status": 400,
 *   "detail": "Field 'user_id' expected int, got str",
 *   "code": "VALIDATION_ERROR",
 *   "timestamp": "2025-07-12T10:30:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ToolStoreException.class)
    public ResponseEntity<ProblemDetail> handleToolStore(ToolStoreException ex) {
        ErrorCode code = ex.code();
        if (code.status() >= 500) {
            log.error("Store failure: {}", ex.getMessage(), ex);
        } else {
            log.warn("Rejected request ({}): {}", code, ex.getMessage());
        }
        HttpStatus status = HttpStatus.valueOf(code.status());
        String detail = code.status() >= 500 ? "The storage engine failed: " + ex.getMessage() : ex.getMessage();
        return ResponseEntity.status(status).body(problem(status, code.title(), detail, code.name()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ProblemDetail> handleInput(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return badRequest(ex.getReason() != null ? ex.getReason() : "Malformed request");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemDetail> handleStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.warn("Request failed with {}: {}", status.value(), ex.getReason());
        String detail = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        return ResponseEntity.status(status).body(problem(status, status.getReasonPhrase(), detail, status.name()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex) {
        log.error("Store failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(problem(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.STORE_ERROR.title(),
                        "The storage engine failed", ErrorCode.STORE_ERROR.name()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                        "An unexpected error occurred", "INTERNAL"));
    }

    private static ResponseEntity<ProblemDetail> badRequest(String detail) {
        return ResponseEntity.badRequest().body(problem(HttpStatus.BAD_REQUEST, "Bad Request", detail, "BAD_REQUEST"));
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail, String code) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("code", code);
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
