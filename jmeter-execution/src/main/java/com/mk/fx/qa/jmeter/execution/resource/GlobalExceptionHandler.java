package com.mk.fx.qa.jmeter.execution.resource;

import com.mk.fx.qa.jmeter.execution.cfg.ErrorResponse;
import com.mk.fx.qa.jmeter.execution.exception.ArtifactNotFoundException;
import com.mk.fx.qa.jmeter.execution.exception.ConflictException;
import com.mk.fx.qa.jmeter.execution.exception.DefinitionNotFoundException;
import com.mk.fx.qa.jmeter.execution.exception.DefinitionValidationException;
import com.mk.fx.qa.jmeter.execution.exception.ReportGenerationException;
import com.mk.fx.qa.jmeter.execution.exception.SaturatedException;
import com.mk.fx.qa.jmeter.execution.exception.ServiceShutdownException;
import com.mk.fx.qa.jmeter.execution.exception.StorageException;
import com.mk.fx.qa.jmeter.execution.exception.TaskNotFoundException;
import com.mk.fx.qa.jmeter.execution.validation.ValidationErrorKind;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(DefinitionValidationException.class)
  public ResponseEntity<ErrorResponse> handleValidation(DefinitionValidationException ex) {
    log.warn("Definition rejected ({}): {}", ex.getKind(), ex.getMessage());
    return responseFactory.error(
        HttpStatus.BAD_REQUEST, "Invalid Definition", ex.getMessage(), ex.getKind().name());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleUploadSize(MaxUploadSizeExceededException ex) {
    log.warn("Upload rejected: {}", ex.getMessage());
    return responseFactory.error(
        HttpStatus.BAD_REQUEST,
        "Invalid Definition",
        "File too large",
        ValidationErrorKind.OVERSIZED.name());
  }

  @ExceptionHandler({
    TaskNotFoundException.class,
    DefinitionNotFoundException.class,
    ArtifactNotFoundException.class
  })
  public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
    log.warn("Not found: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
  }

  @ExceptionHandler(ConflictException.class)
  public ResponseEntity<ErrorResponse> handleConflict(ConflictException ex) {
    log.warn("Conflict: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
  }

  @ExceptionHandler({SaturatedException.class, ServiceShutdownException.class})
  public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException ex) {
    log.warn("Run rejected: {}", ex.getMessage());
    return responseFactory.error(
        HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage());
  }

  @ExceptionHandler({StorageException.class, ReportGenerationException.class})
  public ResponseEntity<ErrorResponse> handleServerSide(RuntimeException ex) {
    log.error("Server-side failure: {}", ex.getMessage(), ex);
    return responseFactory.error(
        HttpStatus.INTERNAL_SERVER_ERROR, "Server Error", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Invalid request body: {}", details);
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Request", details);
  }

  @ExceptionHandler({
    MethodArgumentTypeMismatchException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", ex.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Server Error", ex.getMessage()));
  }
}
