package com.launchdarkly.ssebridge;

import java.util.regex.Pattern;

/**
 * Turns SSE lines into events. This class does no I/O: it is given one line at a time,
 * without its line ending, and returns an event whenever a line completes one.
 * <p>
 * Fields are accumulated until a blank line ends the frame. If the frame contained at least
 * one {@code data} field, an {@link SSEEvent} is produced; otherwise the frame is dropped.
 * Comment lines (starting with a colon) and unknown field names are ignored rather than
 * treated as errors.
 * <p>
 * The event ID is not reset between frames: as the SSE protocol defines it, it remains the
 * last ID that the stream sent until another {@code id} field replaces it.
 * <p>
 * This class is not thread-safe.
 */
final class EventFrameDecoder {
  private static final String DATA = "data";
  private static final String EVENT = "event";
  private static final String ID = "id";
  private static final String RETRY = "retry";

  private static final Pattern DIGITS_ONLY = Pattern.compile("^[\\d]+$");

  private final StringBuilder dataBuffer = new StringBuilder();
  private boolean haveData;   // true if we have seen at least one "data" line so far in this frame
  private String lastEventId; // survives across frames
  private String eventType;
  private Long retryMillis;

  /**
   * Processes one line.
   *
   * @param line a line from the stream, not including the line terminator
   * @return the completed event if this line was the blank line ending a frame that had
   *   data; otherwise null
   */
  SSEEvent decodeLine(String line) {
    if (line.isEmpty()) {
      if (!haveData) {
        resetFrame();
        return null;
      }
      SSEEvent event = new SSEEvent(lastEventId, eventType, dataBuffer.toString(), retryMillis);
      resetFrame();
      return event;
    }

    int colon = line.indexOf(':');
    if (colon == 0) {
      return null; // comment
    }
    String fieldName;
    String fieldValue;
    if (colon < 0) {
      // A line with no colon is a field name with an empty value.
      fieldName = line;
      fieldValue = "";
    } else {
      fieldName = line.substring(0, colon);
      int valueStart = colon + 1;
      if (valueStart < line.length() && line.charAt(valueStart) == ' ') {
        valueStart++; // skip exactly one leading space
      }
      fieldValue = line.substring(valueStart);
    }

    switch (fieldName) {
    case DATA:
      if (haveData) {
        dataBuffer.append('\n');
      }
      dataBuffer.append(fieldValue);
      haveData = true;
      break;
    case EVENT:
      eventType = fieldValue;
      break;
    case ID:
      if (!fieldValue.contains("\u0000")) { // an id field cannot contain a null character
        lastEventId = fieldValue;
      }
      break;
    case RETRY:
      if (DIGITS_ONLY.matcher(fieldValue).matches()) {
        try {
          retryMillis = Long.parseLong(fieldValue);
        } catch (NumberFormatException e) {
          // too many digits for a long; treated like any other invalid retry value
          retryMillis = null;
        }
      }
      break;
    default:
      // For an unrecognized field name, we do nothing.
    }
    return null;
  }

  private void resetFrame() {
    haveData = false;
    eventType = null;
    retryMillis = null;
    dataBuffer.setLength(0);
  }
}
