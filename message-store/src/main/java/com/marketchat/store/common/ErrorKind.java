package com.marketchat.store.common;

/**
 * Failure categories reported by the relay and the store.
 */
public enum ErrorKind {
  PERMISSION_DENIED("PERMISSION_DENIED"),
  NOT_FOUND("NOT_FOUND"),
  VALIDATION_ERROR("VALIDATION_ERROR"),
  STORE_UNAVAILABLE("STORE_UNAVAILABLE"),
  TRANSPORT_DROPPED("TRANSPORT_DROPPED");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
