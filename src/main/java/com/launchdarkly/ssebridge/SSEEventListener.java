package com.launchdarkly.ssebridge;

/**
 * Interface for an object that will receive the connection state changes and events of an
 * {@link SSEClient}.
 * <p>
 * Each state transition is delivered as {@link #onStateChanged(ConnectionState)} followed by
 * the callback for that state, if it has one. Callbacks run on the thread that caused the
 * transition (usually an OkHttp dispatcher thread), unless the client was built with a
 * callback executor. Exceptions thrown from any of these methods are logged and otherwise
 * ignored; they never change the state of the connection.
 * <p>
 * If you only care about events, extend {@link SSEEventListenerAdapter} instead.
 */
public interface SSEEventListener {
  /**
   * Called for every state transition, before the state-specific callback.
   * @param newState the state that the client has just entered
   */
  void onStateChanged(ConnectionState newState);

  /**
   * Called when the server has accepted the request and the event stream is open.
   */
  void onConnected();

  /**
   * Called for each event parsed from the stream, in stream order.
   * @param event the event
   */
  void onEvent(SSEEvent event);

  /**
   * Called when the server ended the stream normally.
   */
  void onClosed();

  /**
   * Called when the connection could not be made, the server returned an error status, or
   * the stream failed while it was being read.
   * <p>
   * The error is normally a {@link StreamHttpErrorException} or a {@link StreamIOException}.
   *
   * @param error the error
   */
  void onFailure(Throwable error);

  /**
   * Called when the connection was ended by {@link SSEClient#disconnect()}.
   */
  void onCancelled();
}
