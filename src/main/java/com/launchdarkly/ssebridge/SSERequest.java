package com.launchdarkly.ssebridge;

import java.util.Map;

import okhttp3.Headers;
import okhttp3.HttpUrl;

/**
 * Describes one stream request: the URL, the HTTP method, request headers, and for POST a
 * request body.
 * <p>
 * Instances are immutable and are validated when they are built, so that an invalid request
 * is reported to the caller as an {@link IllegalArgumentException} before any connection is
 * attempted, rather than through {@link SSEEventListener#onFailure(Throwable)}.
 * <pre><code>
 *   SSERequest request = SSERequest.builder("https://example.com/stream")
 *       .method(SSERequest.Method.POST)
 *       .header("Authorization", "xyz")
 *       .body("{\"prompt\":\"hello\"}")
 *       .build();
 * </code></pre>
 */
public final class SSERequest {
  /**
   * The HTTP methods that can be used to open a stream.
   */
  public enum Method {
    /**
     * An HTTP GET request with no body.
     */
    GET,
    /**
     * An HTTP POST request; a body is required.
     */
    POST
  }

  private final String url;
  private final Method method;
  private final Headers headers;
  private final String body;

  private SSERequest(Builder builder) {
    if (builder.url == null || builder.url.trim().isEmpty()) {
      throw new IllegalArgumentException("URL cannot be blank");
    }
    if (HttpUrl.parse(builder.url) == null) {
      throw new IllegalArgumentException("URL must be a valid http or https URL: " + builder.url);
    }
    if (builder.method == null) {
      throw new IllegalArgumentException("method must not be null");
    }
    if (builder.method == Method.POST && builder.body == null) {
      throw new IllegalArgumentException("Body is required for POST requests");
    }
    this.url = builder.url;
    this.method = builder.method;
    this.headers = builder.headers.build();
    this.body = builder.body;
  }

  /**
   * Creates a GET request with no custom headers.
   *
   * @param url the stream URL
   * @return the request
   * @throws IllegalArgumentException if the URL is blank or invalid
   */
  public static SSERequest get(String url) {
    return builder(url).build();
  }

  /**
   * Creates a GET request.
   *
   * @param url the stream URL
   * @param headers custom headers, or null for none
   * @return the request
   * @throws IllegalArgumentException if the URL is blank or invalid, or a header is invalid
   */
  public static SSERequest get(String url, Map<String, String> headers) {
    return builder(url).headers(headers).build();
  }

  /**
   * Creates a POST request with no custom headers.
   *
   * @param url the stream URL
   * @param body the request body
   * @return the request
   * @throws IllegalArgumentException if the URL is blank or invalid, or the body is null
   */
  public static SSERequest post(String url, String body) {
    return builder(url).method(Method.POST).body(body).build();
  }

  /**
   * Creates a POST request.
   *
   * @param url the stream URL
   * @param body the request body
   * @param headers custom headers, or null for none
   * @return the request
   * @throws IllegalArgumentException if the URL is blank or invalid, the body is null, or a
   *   header is invalid
   */
  public static SSERequest post(String url, String body, Map<String, String> headers) {
    return builder(url).method(Method.POST).headers(headers).body(body).build();
  }

  /**
   * Starts building a request. The default method is GET.
   *
   * @param url the stream URL
   * @return a builder
   */
  public static Builder builder(String url) {
    return new Builder(url);
  }

  /**
   * Returns the stream URL.
   * @return the URL
   */
  public String getUrl() {
    return url;
  }

  /**
   * Returns the HTTP method.
   * @return the method
   */
  public Method getMethod() {
    return method;
  }

  /**
   * Returns the custom request headers, in the order they were added. Header names are
   * case-insensitive and a name may appear more than once.
   * <p>
   * {@code Accept} and {@code Cache-Control} are added by {@link HeaderInterceptor} when the
   * request is sent, and are not included here unless the caller set them.
   *
   * @return the headers
   */
  public Headers getHeaders() {
    return headers;
  }

  /**
   * Returns the request body, which is always present for POST.
   * @return the body, or null
   */
  public String getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "SSERequest(" + method + " " + url + ")";
  }

  /**
   * Builder for {@link SSERequest}.
   */
  public static final class Builder {
    private final String url;
    private Method method = Method.GET;
    private final Headers.Builder headers = new Headers.Builder();
    private String body;

    private Builder(String url) {
      this.url = url;
    }

    /**
     * Sets the HTTP method.
     *
     * @param method the method
     * @return the builder
     */
    public Builder method(Method method) {
      this.method = method;
      return this;
    }

    /**
     * Adds a header. Existing headers with the same name are kept.
     *
     * @param name the header name
     * @param value the header value
     * @return the builder
     * @throws IllegalArgumentException if the name or value contains illegal characters
     */
    public Builder header(String name, String value) {
      headers.add(name, value);
      return this;
    }

    /**
     * Adds all entries of a map as headers, in the map's iteration order.
     *
     * @param headers the headers to add, or null for none
     * @return the builder
     * @throws IllegalArgumentException if a name or value contains illegal characters
     */
    public Builder headers(Map<String, String> headers) {
      if (headers != null) {
        for (Map.Entry<String, String> e: headers.entrySet()) {
          this.headers.add(e.getKey(), e.getValue());
        }
      }
      return this;
    }

    /**
     * Sets the request body. The body is sent as UTF-8 with the content type
     * {@code application/json; charset=utf-8}.
     *
     * @param body the body
     * @return the builder
     */
    public Builder body(String body) {
      this.body = body;
      return this;
    }

    /**
     * Validates the properties and creates the request.
     *
     * @return the request
     * @throws IllegalArgumentException if the URL is blank or invalid, or if the method is
     *   POST and there is no body
     */
    public SSERequest build() {
      return new SSERequest(this);
    }
  }
}
