package com.launchdarkly.ssebridge;

import com.launchdarkly.testhelpers.TypeBehavior;

import org.junit.Test;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

@SuppressWarnings("javadoc")
public class ExceptionTypesTest {
  @Test
  public void streamException() {
    Exception inner1 = new Exception("inner1"), inner2 = new Exception("inner2");

    TypeBehavior.checkEqualsAndHashCode(Arrays.asList(
        () -> new StreamException("a"),
        () -> new StreamException("b"),
        () -> new StreamException((String)null),
        () -> new StreamException(inner1),
        () -> new StreamException(inner2)
        ));
  }

  @Test
  public void streamIOException() {
    IOException inner1 = new IOException("inner1"), inner2 = new IOException("inner2");

    TypeBehavior.checkEqualsAndHashCode(Arrays.asList(
        () -> new StreamIOException(inner1),
        () -> new StreamIOException(inner2),
        () -> new StreamIOException(null)
        ));
    assertSame(inner1, new StreamIOException(inner1).getIOException());
  }

  @Test
  public void streamHttpErrorException() {
    TypeBehavior.checkEqualsAndHashCode(Arrays.asList(
        () -> new StreamHttpErrorException(400),
        () -> new StreamHttpErrorException(401)
        ));
    assertEquals(503, new StreamHttpErrorException(503).getCode());
  }

  @Test
  public void streamContentTypeException() {
    TypeBehavior.checkEqualsAndHashCode(Arrays.asList(
        () -> new StreamContentTypeException("text/html"),
        () -> new StreamContentTypeException("application/json"),
        () -> new StreamContentTypeException(null)
        ));
    assertEquals("text/html", new StreamContentTypeException("text/html").getContentType());
  }
}
