package com.launchdarkly.ssebridge;

import java.util.Objects;

/**
 * An event received from the stream, passed to {@link SSEEventListener#onEvent(SSEEvent)}.
 * <p>
 * Instances are immutable and have no identity beyond their fields; the client does not
 * deduplicate events that repeat an ID.
 */
public final class SSEEvent {
  private final String id;
  private final String type;
  private final String data;
  private final Long retry;

  /**
   * Constructs an event with data only.
   *
   * @param data the event data; if null, will be changed to an empty string
   */
  public SSEEvent(String data) {
    this(null, null, data, null);
  }

  /**
   * Constructs an event.
   *
   * @param id the event ID, or null if none
   * @param type the event type from the {@code event:} field, or null if none
   * @param data the event data; if null, will be changed to an empty string
   * @param retry the reconnection time in milliseconds from the {@code retry:} field, or null
   */
  public SSEEvent(String id, String type, String data, Long retry) {
    this.id = id;
    this.type = type;
    this.data = data == null ? "" : data;
    this.retry = retry;
  }

  /**
   * Returns the event ID, if any.
   * <p>
   * This is the most recent {@code id:} value seen on the stream, which may have been sent
   * with an earlier event.
   *
   * @return the event ID or null
   */
  public String getId() {
    return id;
  }

  /**
   * Returns the value of the {@code event:} field, if any.
   *
   * @return the event type or null
   */
  public String getType() {
    return type;
  }

  /**
   * Returns the event data. Multiple {@code data:} lines are joined with {@code '\n'}.
   * Never null, but may be empty.
   *
   * @return the data string
   */
  public String getData() {
    return data;
  }

  /**
   * Returns the reconnection time sent in the {@code retry:} field of this event, if any.
   * <p>
   * The client does not reconnect by itself. This value is only a hint for applications
   * that call {@link SSEClient#connect(SSERequest)} again after the stream ends.
   *
   * @return the retry time in milliseconds, or null
   */
  public Long getRetry() {
    return retry;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SSEEvent that = (SSEEvent) o;
    return Objects.equals(id, that.id) &&
        Objects.equals(type, that.type) &&
        Objects.equals(data, that.data) &&
        Objects.equals(retry, that.retry);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, data, retry);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("SSEEvent(");
    if (type != null) {
      sb.append("type=").append(type).append(',');
    }
    sb.append("data=").append(data);
    if (id != null) {
      sb.append(",id=").append(id);
    }
    if (retry != null) {
      sb.append(",retry=").append(retry);
    }
    return sb.append(')').toString();
  }
}
