package com.launchdarkly.ssebridge;

import com.launchdarkly.logging.LDLogLevel;

import org.junit.Rule;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;

import static com.launchdarkly.ssebridge.Helpers.UTF8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class EventStreamReaderTest {
  @Rule public TestScopedLoggerRule testLogger = new TestScopedLoggerRule();

  private EventStreamReader readerFor(String content, int bufferSize) {
    return new EventStreamReader(new ByteArrayInputStream(content.getBytes(UTF8)), bufferSize,
        testLogger.getLogger());
  }

  @Test
  public void readsEventsInOrderThenEndOfStream() throws Exception {
    EventStreamReader reader = readerFor("data: one\n\n: comment\nevent: t\ndata: two\n\n", 100);

    assertThat(reader.nextEvent(), equalTo(new SSEEvent("one")));
    assertThat(reader.nextEvent(), equalTo(new SSEEvent(null, "t", "two", null)));
    assertThat(reader.nextEvent(), nullValue());
    assertThat(reader.nextEvent(), nullValue());
  }

  @Test
  public void acceptsAnyLineEnding() throws Exception {
    EventStreamReader reader = readerFor("data: a\r\rdata: b\r\n\r\ndata: c\n\n", 100);

    assertThat(reader.nextEvent(), equalTo(new SSEEvent("a")));
    assertThat(reader.nextEvent(), equalTo(new SSEEvent("b")));
    assertThat(reader.nextEvent(), equalTo(new SSEEvent("c")));
    assertThat(reader.nextEvent(), nullValue());
  }

  @Test
  public void incompleteFrameAtEndIsDiscarded() throws Exception {
    EventStreamReader reader = readerFor("data: done\n\ndata: not done\n", 100);

    assertThat(reader.nextEvent(), equalTo(new SSEEvent("done")));
    assertThat(reader.nextEvent(), nullValue());
  }

  @Test
  public void dataLongerThanBufferWithMultiByteCharacters() throws Exception {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < 50; i++) {
      sb.append("abcdé€");
    }
    String data = sb.toString();
    EventStreamReader reader = readerFor("data: " + data + "\n\n", 7);

    assertThat(reader.nextEvent(), equalTo(new SSEEvent(data)));
  }

  @Test
  public void logsReceivedEvents() throws Exception {
    EventStreamReader reader = readerFor("data: x\n\n", 100);
    reader.nextEvent();
    testLogger.awaitMessageContaining(LDLogLevel.DEBUG, "Received event");
  }

  @Test
  public void ioErrorIsThrown() throws Exception {
    final IOException error = new IOException("broken");
    InputStream failing = new InputStream() {
      @Override
      public int read() throws IOException {
        throw error;
      }

      @Override
      public int read(byte[] b, int off, int len) throws IOException {
        throw error;
      }
    };
    InputStream input = new SequenceInputStream(
        new ByteArrayInputStream("data: first\n\n".getBytes(UTF8)), failing);
    EventStreamReader reader = new EventStreamReader(input, 100, testLogger.getLogger());

    assertThat(reader.nextEvent(), equalTo(new SSEEvent("first")));
    try {
      reader.nextEvent();
      fail("expected exception");
    } catch (IOException e) {
      assertThat(e, sameInstance(error));
    }
  }
}
