package com.launchdarkly.ssebridge;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link Lifecycle} that is destroyed by calling {@link #destroy()}.
 * <p>
 * An observer added after {@code destroy()} is notified immediately.
 */
public final class LifecycleRegistry implements Lifecycle {
  private final AtomicBoolean destroyed = new AtomicBoolean(false);
  private final List<Observer> observers = new CopyOnWriteArrayList<>();

  @Override
  public boolean isDestroyed() {
    return destroyed.get();
  }

  @Override
  public void addObserver(Observer observer) {
    if (observer == null) {
      throw new IllegalArgumentException("observer must not be null");
    }
    observers.add(observer);
    if (destroyed.get() && observers.remove(observer)) {
      observer.onDestroy();
    }
  }

  @Override
  public void removeObserver(Observer observer) {
    observers.remove(observer);
  }

  /**
   * Marks the lifecycle as destroyed and notifies every registered observer once. Later
   * calls do nothing.
   */
  public void destroy() {
    if (!destroyed.compareAndSet(false, true)) {
      return;
    }
    for (Observer o: observers) {
      if (observers.remove(o)) {
        o.onDestroy();
      }
    }
  }
}
