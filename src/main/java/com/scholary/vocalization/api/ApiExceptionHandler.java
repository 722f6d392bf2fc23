package com.scholary.vocalization.api;

import com.scholary.vocalization.artifact.ArtifactNotFoundException;
import com.scholary.vocalization.artifact.FileTooLargeException;
import com.scholary.vocalization.artifact.UploadValidationException;
import com.scholary.vocalization.job.JobNotFoundException;
import com.scholary.vocalization.objectstore.StorageUnavailableException;
import com.scholary.vocalization.result.ResultExpiredException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps exceptions to {@link ApiError} responses.
 *
 * <p>Validation problems are 400 (413 for oversized uploads), unknown ids are 404 and an evicted
 * outcome is 410. An unreachable artifact store is 503; anything else is logged and returned as
 * 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(FileTooLargeException.class)
  public ResponseEntity<ApiError> handleFileTooLarge(FileTooLargeException e) {
    LOGGER.warn("Rejected upload: {}", e.getMessage());
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE", e.getMessage());
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(MaxUploadSizeExceededException e) {
    LOGGER.warn("Rejected upload over multipart limit: {}", e.getMessage());
    return error(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE", "Uploaded file is too large");
  }

  @ExceptionHandler(UploadValidationException.class)
  public ResponseEntity<ApiError> handleValidation(UploadValidationException e) {
    LOGGER.warn("Rejected upload: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", e.getMessage());
  }

  @ExceptionHandler({
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class,
    MissingRequestHeaderException.class
  })
  public ResponseEntity<ApiError> handleMissingInput(Exception e) {
    return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", e.getMessage());
  }

  @ExceptionHandler({ArtifactNotFoundException.class, JobNotFoundException.class})
  public ResponseEntity<ApiError> handleNotFound(RuntimeException e) {
    return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
  }

  @ExceptionHandler(ResultExpiredException.class)
  public ResponseEntity<ApiError> handleResultExpired(ResultExpiredException e) {
    return error(HttpStatus.GONE, "RESULT_EXPIRED", e.getMessage());
  }

  @ExceptionHandler(StorageUnavailableException.class)
  public ResponseEntity<ApiError> handleStorageUnavailable(StorageUnavailableException e) {
    LOGGER.error("Artifact store unavailable", e);
    return error(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", e.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception e) {
    LOGGER.error("Unhandled exception", e);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String error, String message) {
    return ResponseEntity.status(status)
        .body(new ApiError(status.value(), error, message, Instant.now()));
  }
}
