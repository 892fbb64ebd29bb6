package com.example.exchange.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(ValidationException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleBeanValidation(MethodArgumentNotValidException ex) {
    final FieldError fieldError = ex.getBindingResult().getFieldError();
    final String message =
        fieldError == null
            ? "request validation failed"
            : fieldError.getField() + " " + fieldError.getDefaultMessage();
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingRequestHeaderException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, "malformed request");
  }

  @ExceptionHandler(ForbiddenActionException.class)
  public ResponseEntity<ApiErrorResponse> handleForbidden(ForbiddenActionException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.FORBIDDEN, ex.getMessage());
  }

  @ExceptionHandler({
    OfferNotFoundException.class,
    CareRequestNotFoundException.class,
    MatchNotFoundException.class,
    NotificationNotFoundException.class
  })
  public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(StaleTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleStale(StaleTransitionException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.STALE_TRANSITION, ex.getMessage());
  }

  @ExceptionHandler(MatchingUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleMatchingUnavailable(
      MatchingUnavailableException ex) {
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.MATCHING_UNAVAILABLE, ex.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "internal error");
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code.name(), message));
  }
}
