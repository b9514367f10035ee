package com.marketchat.relay.endpoints;

import com.marketchat.relay.service.AttachmentTooLargeException;
import com.marketchat.store.common.ErrorKind;
import com.marketchat.store.common.RelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps relay failures to HTTP responses with an {@link ErrorResponse} body.
 */
@RestControllerAdvice
public class RelayExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(RelayExceptionHandler.class);

  @Value("${relay.upload.max-bytes:10485760}")
  private long maxUploadBytes;

  @ExceptionHandler(AttachmentTooLargeException.class)
  public ResponseEntity<ErrorResponse> handleTooLarge(AttachmentTooLargeException ex) {
    logger.warn("Upload rejected: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ErrorResponse(ex.getCode(), ex.getMessage()));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleMultipartLimit(MaxUploadSizeExceededException ex) {
    AttachmentTooLargeException tooLarge = new AttachmentTooLargeException(maxUploadBytes);
    logger.warn("Upload rejected by multipart limit: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(new ErrorResponse(tooLarge.getCode(), tooLarge.getMessage()));
  }

  @ExceptionHandler(RelayException.class)
  public ResponseEntity<ErrorResponse> handleRelay(RelayException ex) {
    HttpStatus status = statusFor(ex.getKind());
    if (status.is5xxServerError()) {
      logger.error("Request failed ({}): {}", ex.getCode(), ex.getMessage());
    } else {
      logger.warn("Request refused ({}): {}", ex.getCode(), ex.getMessage());
    }
    return ResponseEntity.status(status).body(new ErrorResponse(ex.getCode(), ex.getMessage()));
  }

  @ExceptionHandler({HttpMessageNotReadableException.class,
      MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    logger.warn("Malformed request: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse(ErrorKind.VALIDATION_ERROR.getCode(), ex.getMessage()));
  }

  static HttpStatus statusFor(ErrorKind kind) {
    switch (kind) {
      case VALIDATION_ERROR:
        return HttpStatus.BAD_REQUEST;
      case PERMISSION_DENIED:
        return HttpStatus.FORBIDDEN;
      case NOT_FOUND:
        return HttpStatus.NOT_FOUND;
      case STORE_UNAVAILABLE:
        return HttpStatus.SERVICE_UNAVAILABLE;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }
}
