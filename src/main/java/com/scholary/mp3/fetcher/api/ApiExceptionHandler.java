package com.scholary.mp3.fetcher.api;

import com.scholary.mp3.fetcher.engine.EngineException;
import com.scholary.mp3.fetcher.output.OutputNotFoundException;
import com.scholary.mp3.fetcher.service.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders exceptions as {@code {"error": "..."}} JSON.
 *
 * <p>The content type is set explicitly so clients that only accept {@code text/event-stream}
 * still receive the error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidRequestException.class)
  public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException e) {
    LOGGER.info("Rejected request: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(ApiKeyRejectedException.class)
  public ResponseEntity<ErrorResponse> handleApiKeyRejected(ApiKeyRejectedException e) {
    LOGGER.warn("Rejected request: {}", e.getMessage());
    return error(HttpStatus.FORBIDDEN, e.getMessage());
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleJobNotFound(JobNotFoundException e) {
    LOGGER.info("Unknown or consumed token: {}", e.getToken());
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler({
    EngineException.class,
    OutputNotFoundException.class,
    ConversionException.class
  })
  public ResponseEntity<ErrorResponse> handleConversionFailure(RuntimeException e) {
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage() != null ? e.getMessage() : "unknown error");
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(new ErrorResponse(message));
  }
}
