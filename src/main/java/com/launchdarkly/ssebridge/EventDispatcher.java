package com.launchdarkly.ssebridge;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Delivers state transitions and events to the current {@link SSEEventListener}.
 * <p>
 * Each transition or event becomes one task on the callback executor. When the task runs, it
 * checks again that the client is still open and, for events and the non-terminal states,
 * that the attempt that produced them is still active; if not, nothing is delivered. So once
 * an attempt has ended, the listener never hears {@code CONNECTING} or {@code CONNECTED} for it. The listener is read once at the
 * start of each task, so a listener replaced in the meantime sees either all of a transition
 * or none of it.
 * <p>
 * This class guarantees that exceptions thrown by the listener are never thrown back to the
 * client.
 */
final class EventDispatcher {
  private static final Executor DIRECT = Runnable::run;

  private final Executor executor;
  private final ConnectionStateMachine stateMachine;
  private final BooleanSupplier suppressed;
  private final LDLogger logger;
  private volatile SSEEventListener listener;

  EventDispatcher(
      Executor executor,
      ConnectionStateMachine stateMachine,
      BooleanSupplier suppressed,
      LDLogger logger
      ) {
    this.executor = executor == null ? DIRECT : executor;
    this.stateMachine = stateMachine;
    this.suppressed = suppressed;
    this.logger = logger;
  }

  void setListener(SSEEventListener listener) {
    this.listener = listener;
  }

  // For CONNECTING and CONNECTED; dropped if the attempt has ended by the time the task runs.
  void stateChanged(final long attempt, final ConnectionState newState) {
    logger.debug("Connection state is now {}", newState);
    execute(() -> {
      if (!stateMachine.isActive(attempt)) {
        logger.debug("Not reporting {} for a connection that has already ended", newState);
        return;
      }
      deliverStateChange(newState, null);
    });
  }

  // For terminal states, which are always reported once the state machine has moved to them.
  void stateChanged(final ConnectionState newState, final Throwable error) {
    logger.debug("Connection state is now {}", newState);
    execute(() -> deliverStateChange(newState, error));
  }

  private void deliverStateChange(ConnectionState newState, Throwable error) {
    SSEEventListener l = activeListener();
    if (l == null) {
      return;
    }
    try {
      l.onStateChanged(newState);
    } catch (Exception e) {
      handleUnexpectedError(e);
    }
    try {
      switch (newState) {
      case CONNECTED:
        l.onConnected();
        break;
      case CLOSED:
        l.onClosed();
        break;
      case FAILED:
        l.onFailure(error);
        break;
      case CANCELLED:
        l.onCancelled();
        break;
      default:
        break;
      }
    } catch (Exception e) {
      handleUnexpectedError(e);
    }
  }

  void event(final long attempt, final SSEEvent event) {
    execute(() -> {
      if (!stateMachine.isActive(attempt)) {
        logger.debug("Dropping event from a connection that has already ended");
        return;
      }
      SSEEventListener l = activeListener();
      if (l == null) {
        return;
      }
      try {
        l.onEvent(event);
      } catch (Exception e) {
        handleUnexpectedError(e);
      }
    });
  }

  private SSEEventListener activeListener() {
    if (suppressed.getAsBoolean()) {
      return null;
    }
    return listener;
  }

  private void handleUnexpectedError(Exception e) {
    logger.warn("Caught unexpected error from SSEEventListener: {}", LogValues.exceptionSummary(e));
    logger.debug(LogValues.exceptionTrace(e));
  }

  private void execute(Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) { // COVERAGE: this condition can't be reproduced in unit tests
      logger.warn("Callback executor rejected a listener callback: {}", LogValues.exceptionSummary(e));
    }
  }
}
