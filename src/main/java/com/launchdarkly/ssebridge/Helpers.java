package com.launchdarkly.ssebridge;

import java.io.ByteArrayOutputStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.util.Locale;

import okhttp3.internal.http2.StreamResetException;

abstract class Helpers {
  static final Charset UTF8 = Charset.forName("UTF-8"); // SSE streams are always UTF-8

  private static final String CANCEL_MARKER = "cancel";

  private Helpers() {}

  static String utf8ByteArrayOutputStreamToString(ByteArrayOutputStream bytes) {
    try {
      return bytes.toString(UTF8.name()); // toString(Charset) isn't available in Java 8
    } catch (UnsupportedEncodingException e) {
      // COVERAGE: this shouldn't be possible, but if it somehow happens, all we can do is drop the data
      return null;
    }
  }

  // True if the error, or anything in its cause chain, is an HTTP/2 stream reset that was
  // caused by a cancellation.
  static boolean isCancellationReset(Throwable t) {
    for (Throwable cause = t; cause != null; cause = cause.getCause()) {
      if (cause instanceof StreamResetException) {
        String message = cause.getMessage();
        if (message != null && message.toLowerCase(Locale.ROOT).contains(CANCEL_MARKER)) {
          return true;
        }
      }
    }
    return false;
  }
}
