package com.marketchat.relay.connection;

import java.io.IOException;

/**
 * A live client connection as seen by the relay: an id, liveness, and an
 * ordered outbound channel for serialized events.
 */
public interface ClientConnection {

  String getId();

  boolean isOpen();

  /**
   * Writes one serialized event. Calls from different threads are delivered
   * in the order they were made.
   */
  void send(String payload) throws IOException;

  /**
   * Closes the transport; the disconnect lifecycle runs afterwards.
   */
  void close();
}
