package com.onboardpilot.orchestrator.api;

import com.onboardpilot.orchestrator.circuit.DependencyUnavailableException;
import com.onboardpilot.orchestrator.collaborator.CollaboratorException;
import com.onboardpilot.orchestrator.escalation.EscalationAlreadyResolvedException;
import com.onboardpilot.orchestrator.escalation.EscalationNotFoundException;
import com.onboardpilot.orchestrator.pipeline.BypassRejectedException;
import com.onboardpilot.orchestrator.pipeline.IllegalStageTransitionException;
import com.onboardpilot.orchestrator.pipeline.SessionClosedException;
import com.onboardpilot.orchestrator.pipeline.SessionNotFoundException;
import com.onboardpilot.orchestrator.sla.SlaExtensionRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps domain exceptions to HTTP statuses. Every error body carries
 * {@code timestamp}, {@code status}, {@code error} and {@code message}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({SessionNotFoundException.class, EscalationNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({IllegalStageTransitionException.class,
                       SessionClosedException.class,
                       SlaExtensionRejectedException.class,
                       EscalationAlreadyResolvedException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(BypassRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleBypassRejected(BypassRejectedException ex) {
        log.warn("{}", ex.getMessage());
        return buildErrorResponse(HttpStatus.FORBIDDEN, ex.getMessage());
    }

    @ExceptionHandler(DependencyUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleDependencyUnavailable(DependencyUnavailableException ex) {
        return buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    @ExceptionHandler(CollaboratorException.class)
    public ResponseEntity<Map<String, Object>> handleCollaborator(CollaboratorException ex) {
        log.warn("Collaborator call failed: {}", ex.getMessage());
        return buildErrorResponse(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class,
                       HttpMessageNotReadableException.class,
                       MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new TreeMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now());
        response.put("status",    HttpStatus.BAD_REQUEST.value());
        response.put("error",     "Validation Failed");
        response.put("message",   errors.size() + " invalid field(s)");
        response.put("errors",    errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now());
        response.put("status",    status.value());
        response.put("error",     status.getReasonPhrase());
        response.put("message",   message);
        return ResponseEntity.status(status).body(response);
    }
}
