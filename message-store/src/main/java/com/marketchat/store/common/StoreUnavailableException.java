package com.marketchat.store.common;

/**
 * The message store did not acknowledge within budget. Nothing was persisted
 * and nothing was emitted; the caller may retry.
 */
public class StoreUnavailableException extends RelayException {

  private static final long serialVersionUID = 1L;

  public StoreUnavailableException(String message) {
    super(ErrorKind.STORE_UNAVAILABLE, message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(ErrorKind.STORE_UNAVAILABLE, message, cause);
  }
}
