package com.launchdarkly.ssebridge;

/**
 * Enum values that can be returned by {@link SSEClient#getState()}.
 */
public enum ConnectionState {
  /**
   * {@link SSEClient#connect(SSERequest)} has not yet been called.
   */
  IDLE,
  /**
   * The client has issued a request and is waiting for the stream to open.
   */
  CONNECTING,
  /**
   * The stream is open and the client is receiving events.
   */
  CONNECTED,
  /**
   * The server ended the stream normally.
   */
  CLOSED,
  /**
   * The connection attempt or the open stream failed.
   */
  FAILED,
  /**
   * The stream was cancelled from the client side.
   */
  CANCELLED;

  /**
   * Returns true for {@link #CONNECTING} and {@link #CONNECTED}.
   *
   * @return true if a stream is in progress
   */
  public boolean isActive() {
    return this == CONNECTING || this == CONNECTED;
  }

  /**
   * Returns true for the states that end a connection attempt: {@link #CLOSED}, {@link #FAILED}
   * and {@link #CANCELLED}. No further callbacks fire for an attempt once it reaches one of them.
   *
   * @return true if this is a terminal state
   */
  public boolean isTerminal() {
    return this == CLOSED || this == FAILED || this == CANCELLED;
  }
}
