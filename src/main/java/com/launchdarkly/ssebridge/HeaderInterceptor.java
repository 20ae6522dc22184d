package com.launchdarkly.ssebridge;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import okhttp3.Request;
import okhttp3.Response;

/**
 * Sets the headers that every event-stream request needs: {@code Accept: text/event-stream}
 * and {@code Cache-Control: no-cache}, plus any additional headers given to the constructor.
 * <p>
 * These values replace any header of the same name that the {@link SSERequest} specified.
 * {@link SSEClient} installs one instance, with no additional headers, ahead of the
 * application's own interceptors.
 */
public final class HeaderInterceptor implements SSEInterceptor {
  static final String ACCEPT_HEADER = "Accept";
  static final String EVENT_STREAM_CONTENT_TYPE = "text/event-stream";
  static final String CACHE_CONTROL_HEADER = "Cache-Control";
  static final String NO_CACHE = "no-cache";

  private final Map<String, String> additionalHeaders;

  /**
   * Creates an interceptor that sets only the standard event-stream headers.
   */
  public HeaderInterceptor() {
    this(null);
  }

  /**
   * Creates an interceptor that sets the standard event-stream headers and then the given
   * headers.
   *
   * @param additionalHeaders headers to set on every request; may be null
   */
  public HeaderInterceptor(Map<String, String> additionalHeaders) {
    this.additionalHeaders = additionalHeaders == null ? Collections.<String, String>emptyMap() :
      Collections.unmodifiableMap(new LinkedHashMap<>(additionalHeaders));
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request.Builder builder = chain.request().newBuilder()
        .header(ACCEPT_HEADER, EVENT_STREAM_CONTENT_TYPE)
        .header(CACHE_CONTROL_HEADER, NO_CACHE);
    for (Map.Entry<String, String> e: additionalHeaders.entrySet()) {
      builder.header(e.getKey(), e.getValue());
    }
    return chain.proceed(builder.build());
  }
}
