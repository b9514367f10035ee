package com.marketchat.store.common;

/**
 * Base of every failure the messaging core reports. Unchecked; the kind
 * decides how callers react.
 */
public abstract class RelayException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  protected RelayException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected RelayException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getCode() {
    return kind.getCode();
  }
}
