package com.launchdarkly.ssebridge;

import org.junit.Test;

import java.io.IOException;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import okhttp3.internal.http2.ErrorCode;
import okhttp3.internal.http2.StreamResetException;

@SuppressWarnings("javadoc")
public class HelpersTest {
  @Test
  public void cancelledStreamResetIsCancellation() {
    assertTrue(Helpers.isCancellationReset(new StreamResetException(ErrorCode.CANCEL)));
  }

  @Test
  public void wrappedCancelledStreamResetIsCancellation() {
    IOException wrapper = new IOException("outer", new StreamResetException(ErrorCode.CANCEL));
    assertTrue(Helpers.isCancellationReset(wrapper));
  }

  @Test
  public void otherStreamResetIsNotCancellation() {
    assertFalse(Helpers.isCancellationReset(new StreamResetException(ErrorCode.PROTOCOL_ERROR)));
  }

  @Test
  public void otherErrorMentioningCancelIsNotCancellation() {
    assertFalse(Helpers.isCancellationReset(new IOException("Canceled")));
    assertFalse(Helpers.isCancellationReset(null));
  }
}
