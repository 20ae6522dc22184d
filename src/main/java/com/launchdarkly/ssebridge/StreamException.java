package com.launchdarkly.ssebridge;

import java.util.Objects;

/**
 * Base class for the errors that {@link SSEClient} passes to
 * {@link SSEEventListener#onFailure(Throwable)}.
 * <p>
 * A failure always ends the current connection attempt. The client does not retry; the
 * application decides whether and when to call {@link SSEClient#connect(SSERequest)} again.
 */
@SuppressWarnings("serial")
public class StreamException extends Exception {
  /**
   * Base class constructor.
   * @param message the error message
   */
  protected StreamException(String message) {
    super(message);
  }

  /**
   * Base class constructor.
   * @param cause a wrapped exception
   */
  protected StreamException(Exception cause) {
    super(cause);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    StreamException that = (StreamException) o;
    return Objects.equals(getMessage(), that.getMessage()) &&
        Objects.equals(getCause(), that.getCause());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getMessage(), getCause());
  }
}
