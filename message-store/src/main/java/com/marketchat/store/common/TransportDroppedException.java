package com.marketchat.store.common;

/**
 * A fan-out target connection is no longer live. Raised per recipient and
 * never allowed to abort delivery to the others.
 */
public class TransportDroppedException extends RelayException {

  private static final long serialVersionUID = 1L;

  private final String connectionId;

  public TransportDroppedException(String connectionId, String message) {
    super(ErrorKind.TRANSPORT_DROPPED, message);
    this.connectionId = connectionId;
  }

  public TransportDroppedException(String connectionId, String message, Throwable cause) {
    super(ErrorKind.TRANSPORT_DROPPED, message, cause);
    this.connectionId = connectionId;
  }

  public String getConnectionId() {
    return connectionId;
  }
}
