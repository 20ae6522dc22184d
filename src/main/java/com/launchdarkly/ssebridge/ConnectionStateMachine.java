package com.launchdarkly.ssebridge;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the {@link ConnectionState} of an {@link SSEClient} together with the number of the
 * connection attempt it belongs to.
 * <p>
 * Each {@link #begin()} starts a new attempt. Transport callbacks pass their attempt number
 * back in, so a late callback from an attempt that has already finished (for instance one
 * that was cancelled by {@code disconnect}) cannot change the state of a newer attempt. All
 * transitions are compare-and-set operations and never block.
 */
final class ConnectionStateMachine {
  static final long NO_ATTEMPT = -1;

  private static final class Snapshot {
    final ConnectionState state;
    final long attempt;

    Snapshot(ConnectionState state, long attempt) {
      this.state = state;
      this.attempt = attempt;
    }
  }

  private final AtomicReference<Snapshot> current =
      new AtomicReference<>(new Snapshot(ConnectionState.IDLE, 0));

  ConnectionState getState() {
    return current.get().state;
  }

  /**
   * Moves to {@link ConnectionState#CONNECTING} with a new attempt number, unless an attempt
   * is already active.
   *
   * @return the new attempt number, or {@link #NO_ATTEMPT} if one was already active
   */
  long begin() {
    while (true) {
      Snapshot s = current.get();
      if (s.state.isActive()) {
        return NO_ATTEMPT;
      }
      Snapshot next = new Snapshot(ConnectionState.CONNECTING, s.attempt + 1);
      if (current.compareAndSet(s, next)) {
        return next.attempt;
      }
    }
  }

  /**
   * Moves from {@link ConnectionState#CONNECTING} to {@link ConnectionState#CONNECTED}.
   *
   * @param attempt the attempt that received a response
   * @return true if the transition happened
   */
  boolean open(long attempt) {
    Snapshot s = current.get();
    return s.attempt == attempt && s.state == ConnectionState.CONNECTING &&
        current.compareAndSet(s, new Snapshot(ConnectionState.CONNECTED, attempt));
  }

  /**
   * Ends an active attempt with a terminal state.
   *
   * @param attempt the attempt that ended
   * @param terminal {@link ConnectionState#CLOSED}, {@link ConnectionState#FAILED} or
   *   {@link ConnectionState#CANCELLED}
   * @return true if the transition happened; false if the attempt had already ended
   */
  boolean finish(long attempt, ConnectionState terminal) {
    if (!terminal.isTerminal()) {
      throw new IllegalArgumentException("not a terminal state: " + terminal);
    }
    while (true) {
      Snapshot s = current.get();
      if (s.attempt != attempt || !s.state.isActive()) {
        return false;
      }
      if (current.compareAndSet(s, new Snapshot(terminal, attempt))) {
        return true;
      }
    }
  }

  /**
   * Moves whatever attempt is active to {@link ConnectionState#CANCELLED}.
   *
   * @return true if an attempt was active
   */
  boolean cancel() {
    while (true) {
      Snapshot s = current.get();
      if (!s.state.isActive()) {
        return false;
      }
      if (current.compareAndSet(s, new Snapshot(ConnectionState.CANCELLED, s.attempt))) {
        return true;
      }
    }
  }

  boolean isActive(long attempt) {
    Snapshot s = current.get();
    return s.attempt == attempt && s.state.isActive();
  }
}
