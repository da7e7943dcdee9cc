package decentralabs.attendance.exception;

import decentralabs.attendance.util.LogSanitizer;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Global exception handler for all controllers
 * Provides centralized, consistent error handling
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handles validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> response = body("invalid_request", "Validation failed");
        response.put("errors", errors);

        log.warn("Validation error: {}", errors);
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", LogSanitizer.sanitize(ex.getMostSpecificCause().getMessage()));
        return ResponseEntity.badRequest().body(body("invalid_request", "Malformed request body"));
    }

    /**
     * Session parameters rejected at open time
     */
    @ExceptionHandler(InvalidSessionConfigException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSessionConfig(InvalidSessionConfigException ex) {
        Map<String, Object> response = body("invalid_config", ex.getMessage());
        response.put("field", ex.getField());

        log.warn("Invalid session configuration [{}]: {}", ex.getField(), ex.getMessage());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(SessionNotOpenException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotOpen(SessionNotOpenException ex) {
        log.info("Operation on closed session {}", ex.getSessionId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("session_not_open", ex.getMessage()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        log.info("{} not found", ex.getResource());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(ex.getResource() + "_not_found", ex.getMessage()));
    }

    /**
     * Handles illegal argument exceptions
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", LogSanitizer.sanitize(ex.getMessage()));
        return ResponseEntity.badRequest().body(body("invalid_request", ex.getMessage()));
    }

    /**
     * Handles security exceptions
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<Map<String, Object>> handleSecurityException(SecurityException ex) {
        log.warn("Security exception: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body("forbidden", ex.getMessage()));
    }

    /**
     * Handles all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        // Log full stack trace for debugging but don't expose to client
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body("internal_error", "An unexpected error occurred"));
    }

    private Map<String, Object> body(String code, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("code", code);
        response.put("message", message);
        return response;
    }
}
