package com.roomintake.whatsapp.api;

import com.roomintake.whatsapp.domain.StoreUnavailableException;
import java.time.Instant;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Error bodies for the JSON endpoints. The webhook answers the provider on its own. */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ErrorResponse> storeUnavailable(StoreUnavailableException e) {
    log.error("Session store unavailable", e);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of("STORE_UNAVAILABLE", "Session store is unavailable, retry later"));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> invalidMessage(MethodArgumentNotValidException e) {
    String fields =
        e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
    log.debug("Rejected dev message: {}", fields);
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of("INVALID_MESSAGE", "Invalid dev message: " + fields));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> invalidDirective(IllegalArgumentException e) {
    log.warn("Rejected request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_INPUT", e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> unexpected(Exception e) {
    log.error("Intake request failed", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("INTAKE_ERROR", "Intake request failed"));
  }

  public record ErrorResponse(String code, String message, Instant timestamp) {
    static ErrorResponse of(String code, String message) {
      return new ErrorResponse(code, message, Instant.now());
    }
  }
}
