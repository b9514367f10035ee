package com.marketchat.store.common;

/**
 * Required fields missing or malformed. Never partially applied.
 */
public class ValidationException extends RelayException {

  private static final long serialVersionUID = 1L;

  public ValidationException(String message) {
    super(ErrorKind.VALIDATION_ERROR, message);
  }
}
