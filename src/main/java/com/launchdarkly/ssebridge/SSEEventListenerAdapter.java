package com.launchdarkly.ssebridge;

/**
 * An {@link SSEEventListener} whose methods do nothing, except {@link #onEvent(SSEEvent)}
 * which subclasses must implement.
 */
public abstract class SSEEventListenerAdapter implements SSEEventListener {
  @Override
  public void onStateChanged(ConnectionState newState) {}

  @Override
  public void onConnected() {}

  @Override
  public void onClosed() {}

  @Override
  public void onFailure(Throwable error) {}

  @Override
  public void onCancelled() {}
}
