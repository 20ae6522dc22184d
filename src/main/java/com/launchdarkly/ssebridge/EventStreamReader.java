package com.launchdarkly.ssebridge;

import com.launchdarkly.logging.LDLogger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads {@link SSEEvent}s from an open stream.
 * <p>
 * SSEClient creates one of these as soon as a response arrives, passing in the response body.
 * EventStreamReader knows nothing about HTTP. Each call to {@link #nextEvent()} blocks until an
 * event is complete or the stream has ended, so the result is a lazy sequence of events that
 * can be consumed only once.
 * <p>
 * EventStreamReader should only be used by the thread that is reading the response.
 */
final class EventStreamReader {
  static final int DEFAULT_READ_BUFFER_SIZE = 1000;

  private final BufferedLineReader lineReader;
  private final EventFrameDecoder decoder = new EventFrameDecoder();
  private final LDLogger logger;

  EventStreamReader(InputStream inputStream, int readBufferSize, LDLogger logger) {
    this.lineReader = new BufferedLineReader(inputStream, readBufferSize);
    this.logger = logger;
  }

  /**
   * Returns the next event from the stream.
   *
   * @return the next event, or null if the stream has ended; an incomplete frame at the end of
   *   the stream is discarded
   * @throws IOException if the stream fails; do not use this reader again after that
   */
  SSEEvent nextEvent() throws IOException {
    String line;
    while ((line = lineReader.readLine()) != null) {
      SSEEvent event = decoder.decodeLine(line);
      if (event != null) {
        logger.debug("Received event: {}", event);
        return event;
      }
    }
    logger.debug("End of stream");
    return null;
  }
}
