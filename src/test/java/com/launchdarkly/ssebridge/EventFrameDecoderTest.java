package com.launchdarkly.ssebridge;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

@SuppressWarnings("javadoc")
public class EventFrameDecoderTest {
  private final EventFrameDecoder decoder = new EventFrameDecoder();

  private List<SSEEvent> decode(String... lines) {
    List<SSEEvent> events = new ArrayList<>();
    for (String line: lines) {
      SSEEvent e = decoder.decodeLine(line);
      if (e != null) {
        events.add(e);
      }
    }
    return events;
  }

  @Test
  public void dataOnly() {
    assertThat(decode("data: hello", ""), contains(new SSEEvent("hello")));
  }

  @Test
  public void allFields() {
    assertThat(decode("id: 7", "event: greeting", "retry: 3000", "data: hi", ""),
        contains(new SSEEvent("7", "greeting", "hi", 3000L)));
  }

  @Test
  public void multipleDataLinesAreJoinedWithNewline() {
    assertThat(decode("data: a", "data: b", "data:", "data: c", ""),
        contains(new SSEEvent("a\nb\n\nc")));
  }

  @Test
  public void onlyOneLeadingSpaceIsRemoved() {
    assertThat(decode("data:  two spaces", "data:none", ""),
        contains(new SSEEvent(" two spaces\nnone")));
  }

  @Test
  public void lineWithoutColonIsFieldWithEmptyValue() {
    assertThat(decode("data", ""), contains(new SSEEvent("")));
    assertThat(decode("event", "data: x", ""), contains(new SSEEvent(null, "", "x", null)));
  }

  @Test
  public void commentsAreIgnored() {
    assertThat(decode(": keep-alive", "data: x", ": another", ""), contains(new SSEEvent("x")));
  }

  @Test
  public void unknownFieldsAreIgnored() {
    assertThat(decode("foo: bar", "data: x", "Data: y", ""), contains(new SSEEvent("x")));
  }

  @Test
  public void frameWithoutDataProducesNothing() {
    assertThat(decode("event: ping", "id: 1", "retry: 50", ""), empty());
    assertThat(decode(""), empty());
  }

  @Test
  public void typeAndRetryResetAfterEachFrame() {
    assertThat(decode("event: a", "retry: 10", "data: 1", "", "data: 2", ""),
        contains(new SSEEvent(null, "a", "1", 10L), new SSEEvent("2")));
  }

  @Test
  public void typeAndRetryResetAfterFrameWithoutData() {
    assertThat(decode("event: a", "retry: 10", "", "data: 2", ""), contains(new SSEEvent("2")));
  }

  @Test
  public void idCarriesOverToLaterEvents() {
    assertThat(decode("id: 1", "data: a", "", "data: b", "", "id: 2", "data: c", ""),
        contains(new SSEEvent("1", null, "a", null), new SSEEvent("1", null, "b", null),
            new SSEEvent("2", null, "c", null)));
  }

  @Test
  public void emptyIdReplacesPreviousId() {
    assertThat(decode("id: 1", "data: a", "", "id", "data: b", ""),
        contains(new SSEEvent("1", null, "a", null), new SSEEvent("", null, "b", null)));
  }

  @Test
  public void idContainingNullIsIgnored() {
    assertThat(decode("id: 1", "data: a", "", "id: 2\u0000", "data: b", ""),
        contains(new SSEEvent("1", null, "a", null), new SSEEvent("1", null, "b", null)));
  }

  @Test
  public void invalidRetryIsIgnored() {
    List<SSEEvent> events = decode("retry: 12x", "data: a", "", "retry: -5", "data: b", "",
        "retry: 99999999999999999999", "data: c", "");
    assertThat(events.size(), equalTo(3));
    for (SSEEvent e: events) {
      assertThat(e.getRetry(), nullValue());
    }
  }

  @Test
  public void lastValidRetryInFrameWins() {
    assertThat(decode("retry: 10", "retry: bad", "retry: 20", "data: a", ""),
        contains(new SSEEvent(null, null, "a", 20L)));
  }
}
