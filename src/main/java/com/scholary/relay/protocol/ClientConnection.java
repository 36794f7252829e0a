package com.scholary.relay.protocol;

import java.io.IOException;

/**
 * The relay's view of one client connection.
 *
 * <p>Implementations must allow {@link #send} to be called from the connection thread and the
 * recognition worker thread concurrently.
 */
public interface ClientConnection {

  /** Connection identifier, used for logging. */
  String id();

  boolean isOpen();

  /**
   * Send one message.
   *
   * @throws IOException if the connection is gone or the write fails
   */
  void send(ServerMessage message) throws IOException;

  /**
   * Close the connection with the given code.
   *
   * @throws IOException if the close handshake cannot be sent
   */
  void close(CloseCode code, String reason) throws IOException;
}
