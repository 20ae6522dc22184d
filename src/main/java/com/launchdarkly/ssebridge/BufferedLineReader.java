package com.launchdarkly.ssebridge;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a byte stream one line at a time, where a line may end with CR (\r), LF (\n), or
 * CRLF. The SSE protocol allows any of these line endings for any line in the stream.
 * <p>
 * Bytes are read into a fixed-size buffer. A line that does not fit in the buffer is
 * accumulated in a secondary buffer until its terminator arrives. Each line is decoded as
 * UTF-8 only once it is complete, so a multi-byte character that is split across two reads
 * is decoded correctly.
 * <p>
 * This class is not thread-safe.
 */
final class BufferedLineReader {
  static final int PENDING_BUFFER_INITIAL_CAPACITY = 1000;

  private final InputStream stream;
  private final byte[] readBuffer;
  private int readBufferCount = 0;
  private int scanPos = 0;
  private boolean lastCharWasCr = false;
  private boolean eof = false;
  private ByteArrayOutputStream pending; // holds the start of a line that was longer than one read

  BufferedLineReader(InputStream stream, int bufferSize) {
    if (bufferSize <= 0) {
      throw new IllegalArgumentException("bufferSize must be greater than zero");
    }
    this.stream = stream;
    this.readBuffer = new byte[bufferSize];
  }

  /**
   * Blocks until a complete line is available and returns it without its line ending.
   * <p>
   * Returns null once the stream has ended. If the stream ends in the middle of a line, that
   * unterminated line is discarded.
   *
   * @return the next line, or null at end of stream
   * @throws IOException if the underlying stream threw an exception
   */
  String readLine() throws IOException {
    while (true) {
      if (scanPos >= readBufferCount && !readMoreIntoBuffer()) {
        resetPending();
        return null;
      }
      if (lastCharWasCr) {
        // The previous read ended in CR, so we couldn't tell at that time whether it was a
        // plain CR or part of a CRLF. The line has already been returned; skip a following LF.
        lastCharWasCr = false;
        if (readBuffer[scanPos] == '\n') {
          scanPos++;
          continue;
        }
      }

      int lineStart = scanPos;
      while (scanPos < readBufferCount && readBuffer[scanPos] != '\n' && readBuffer[scanPos] != '\r') {
        scanPos++;
      }
      if (scanPos == readBufferCount) {
        // No terminator yet; keep what we have and read more from the stream.
        appendPending(lineStart, scanPos - lineStart);
        continue;
      }

      String line = completeLine(lineStart, scanPos - lineStart);
      byte terminator = readBuffer[scanPos++];
      if (terminator == '\r') {
        if (scanPos == readBufferCount) {
          lastCharWasCr = true;
        } else if (readBuffer[scanPos] == '\n') {
          scanPos++;
        }
      }
      return line;
    }
  }

  private String completeLine(int offset, int length) {
    if (pending == null || pending.size() == 0) {
      return length == 0 ? "" : new String(readBuffer, offset, length, Helpers.UTF8);
    }
    pending.write(readBuffer, offset, length);
    String line = Helpers.utf8ByteArrayOutputStreamToString(pending);
    resetPending();
    return line;
  }

  private void appendPending(int offset, int length) {
    if (length == 0) {
      return;
    }
    if (pending == null) {
      pending = new ByteArrayOutputStream(PENDING_BUFFER_INITIAL_CAPACITY);
    }
    pending.write(readBuffer, offset, length);
  }

  private void resetPending() {
    if (pending != null) {
      if (pending.size() > PENDING_BUFFER_INITIAL_CAPACITY) {
        pending = null; // don't want it to grow indefinitely, and might not ever need it again
      } else {
        pending.reset();
      }
    }
  }

  private boolean readMoreIntoBuffer() throws IOException {
    if (eof) {
      return false;
    }
    int readCount = stream.read(readBuffer, 0, readBuffer.length);
    if (readCount < 0) {
      eof = true;
      readBufferCount = scanPos = 0;
      return false; // stream was closed
    }
    readBufferCount = readCount;
    scanPos = 0;
    return true;
  }
}
