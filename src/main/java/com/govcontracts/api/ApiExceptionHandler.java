package com.govcontracts.api;

import com.govcontracts.domain.exception.ContractsException;
import com.govcontracts.domain.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@code {success: false, error, code}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ContractsException.class)
    public ResponseEntity<Map<String, Object>> handleContracts(ContractsException e) {
        ErrorKind kind = e.getKind();
        HttpStatus status;
        if (kind.isValidation()) {
            status = HttpStatus.BAD_REQUEST;
            log.warn("Rejected request ({}): {}", kind.code(), e.getMessage());
        } else if (kind == ErrorKind.TASK_NOT_FOUND) {
            status = HttpStatus.NOT_FOUND;
            log.info("{}", e.getMessage());
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            log.error("Request failed ({}): {}", kind.code(), e.getMessage(), e);
        }
        return body(status, e.getMessage(), kind.code());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(field -> field + " is invalid")
                .collect(Collectors.joining(", "));
        return body(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message,
                ErrorKind.VALIDATION.code());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Malformed request body", ErrorKind.VALIDATION.code());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", "internal");
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
