package com.launchdarkly.ssebridge;

import com.launchdarkly.logging.LDLogger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertNull;

class Stubs {
  static class LogItem {
    final String action;
    private final String[] params;
    final Throwable error;

    private LogItem(String action, String[] params, Throwable error) {
      this.action = action;
      this.params = params;
      this.error = error;
    }

    private LogItem(String action, String... params) {
      this(action, params.length == 0 ? null : params, null);
    }

    public static LogItem state(ConnectionState state) {
      return new LogItem("state", state.name());
    }

    public static LogItem connected() {
      return new LogItem("connected");
    }

    public static LogItem event(String data) {
      return new LogItem("event", data);
    }

    public static LogItem event(String type, String data, String id) {
      return new LogItem("event", type, data, id);
    }

    public static LogItem closed() {
      return new LogItem("closed");
    }

    public static LogItem failure(Throwable t) {
      return new LogItem("failure", new String[] { t.toString() }, t);
    }

    public static LogItem cancelled() {
      return new LogItem("cancelled");
    }

    public String toString() {
      StringBuilder sb = new StringBuilder().append(action);
      if (params != null) {
        sb.append("(");
        for (int i = 0; i < params.length; i++) {
          if (i > 0) {
            sb.append(",");
          }
          sb.append(params[i]);
        }
        sb.append(")");
      }
      return sb.toString();
    }

    public boolean equals(Object o) {
      return (o instanceof LogItem) && toString().equals(o.toString());
    }

    public int hashCode() {
      return toString().hashCode();
    }
  }

  static class TestListener implements SSEEventListener {
    private final BlockingQueue<LogItem> log = new LinkedBlockingQueue<>();
    private final LDLogger logger;
    private final boolean eventsWithDetails;
    volatile RuntimeException fakeError = null;

    public TestListener() {
      this(null, false);
    }

    public TestListener(LDLogger logger) {
      this(logger, false);
    }

    public TestListener(LDLogger logger, boolean eventsWithDetails) {
      this.logger = logger;
      this.eventsWithDetails = eventsWithDetails;
    }

    private void maybeError() {
      if (fakeError != null) {
        throw fakeError;
      }
    }

    @Override
    public void onStateChanged(ConnectionState newState) {
      add(LogItem.state(newState));
    }

    @Override
    public void onConnected() {
      add(LogItem.connected());
      maybeError();
    }

    @Override
    public void onEvent(SSEEvent event) {
      add(eventsWithDetails ? LogItem.event(event.getType(), event.getData(), event.getId()) :
        LogItem.event(event.getData()));
      maybeError();
    }

    @Override
    public void onClosed() {
      add(LogItem.closed());
    }

    @Override
    public void onFailure(Throwable error) {
      add(LogItem.failure(error));
    }

    @Override
    public void onCancelled() {
      add(LogItem.cancelled());
    }

    private void add(LogItem item) {
      if (logger != null) {
        logger.debug("TestListener received: {}", item);
      }
      log.add(item);
    }

    LogItem awaitLogItem() {
      int timeoutSeconds = 5;
      try {
        LogItem item = log.poll(timeoutSeconds, TimeUnit.SECONDS);
        if (item == null) {
          throw new RuntimeException("listener did not get an expected call within " + timeoutSeconds + " seconds");
        }
        return item;
      } catch (InterruptedException e) {
        throw new RuntimeException("thread interrupted while waiting for listener to be called");
      }
    }

    void assertNoMoreLogItems() {
      try {
        assertNull(log.poll(100, TimeUnit.MILLISECONDS));
      } catch (InterruptedException e) {}
    }
  }

  // Runs tasks only when the test says so.
  static class QueuedExecutor implements Executor {
    private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();

    @Override
    public void execute(Runnable command) {
      tasks.add(command);
    }

    int runAll() {
      int count = 0;
      Runnable r;
      while ((r = tasks.poll()) != null) {
        r.run();
        count++;
      }
      return count;
    }

    int size() {
      return tasks.size();
    }
  }
}
