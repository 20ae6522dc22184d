package com.launchdarkly.ssebridge;

/**
 * The lifetime of whatever owns an {@link SSEClient}, such as a screen or a request scope.
 * <p>
 * When the owner is destroyed, the client closes itself: the stream is cancelled, its
 * resources are released, and no further listener callbacks are made. See
 * {@link LifecycleRegistry} for an implementation that the owner drives directly.
 */
public interface Lifecycle {
  /**
   * Returns true once the owner has been destroyed. It never becomes false again.
   * @return true if destroyed
   */
  boolean isDestroyed();

  /**
   * Registers an observer to be notified when the owner is destroyed.
   * @param observer the observer
   */
  void addObserver(Observer observer);

  /**
   * Unregisters an observer.
   * @param observer the observer
   */
  void removeObserver(Observer observer);

  /**
   * Receives the destroyed signal of a {@link Lifecycle}.
   */
  interface Observer {
    /**
     * Called once, when the owner is destroyed.
     */
    void onDestroy();
  }
}
