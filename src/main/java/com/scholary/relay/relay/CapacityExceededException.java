package com.scholary.relay.relay;

/** Thrown when the recognition worker pool cannot take another relay. */
public class CapacityExceededException extends RuntimeException {

  public CapacityExceededException(String message, Throwable cause) {
    super(message, cause);
  }
}
