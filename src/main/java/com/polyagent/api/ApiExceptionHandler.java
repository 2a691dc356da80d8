package com.polyagent.api;

import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(CollaborationException.class)
    public ResponseEntity<ErrorResponse> handleCollaboration(CollaborationException ex) {
        CollaborationErrorKind kind = ex.getKind();
        if (kind.status().is5xxServerError()) {
            log.warn("Collaboration request failed ({}): {}", kind, ex.getMessage());
        }
        return ResponseEntity.status(kind.status())
                .body(new ErrorResponse(kind.name(), ex.getMessage(), ex.getSessionId(), ex.isRetryable()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return invalidRequest(message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return invalidRequest("Malformed request body.");
    }

    private ResponseEntity<ErrorResponse> invalidRequest(String message) {
        CollaborationErrorKind kind = CollaborationErrorKind.INVALID_REQUEST;
        return ResponseEntity.status(kind.status())
                .body(new ErrorResponse(kind.name(), message, null, kind.retryable()));
    }
}
