package com.launchdarkly.ssebridge;

/**
 * An exception indicating that the server answered the stream request with a 2xx status but
 * a body that is not {@code text/event-stream}, so the stream was never opened.
 *
 * @see StreamException
 */
@SuppressWarnings("serial")
public class StreamContentTypeException extends StreamException {

  private final String contentType;

  /**
   * Constructs an instance.
   * @param contentType the Content-Type the server sent, or null if there was none
   */
  public StreamContentTypeException(String contentType) {
    super("Invalid content-type: " + contentType);
    this.contentType = contentType;
  }

  /**
   * Returns the Content-Type the server sent.
   * @return the content type, or null if the response had none
   */
  public String getContentType() {
    return contentType;
  }
}
