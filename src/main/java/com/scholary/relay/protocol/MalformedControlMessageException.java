package com.scholary.relay.protocol;

/**
 * Exception thrown when a text frame is not a recognised control message.
 *
 * <p>This is recoverable: the relay logs it and keeps streaming.
 */
public class MalformedControlMessageException extends RuntimeException {

  public MalformedControlMessageException(String message) {
    super(message);
  }

  public MalformedControlMessageException(String message, Throwable cause) {
    super(message, cause);
  }
}
