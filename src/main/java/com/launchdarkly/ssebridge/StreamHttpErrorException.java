package com.launchdarkly.ssebridge;

/**
 * An exception indicating that the server answered the stream request with a non-2xx
 * HTTP status, so the stream was never opened.
 *
 * @see StreamException
 */
@SuppressWarnings("serial")
public class StreamHttpErrorException extends StreamException {

  private final int code;

  /**
   * Constructs an instance.
   * @param code the HTTP status
   */
  public StreamHttpErrorException(int code) {
    super("Server returned HTTP error " + code);
    this.code = code;
  }

  /**
   * Returns the HTTP status code.
   * @return the HTTP status
   */
  public int getCode() {
    return code;
  }
}
