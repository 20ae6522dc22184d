package com.launchdarkly.ssebridge;

import com.launchdarkly.logging.LDLogger;

import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * The simplest way to consume a Server-Sent Events endpoint.
 * <p>
 * SSEBridge wraps an {@link SSEClient} and adds shortcuts for the two kinds of request:
 * <pre><code>
 *   SSEBridge bridge = new SSEBridge.Builder()
 *       .lifecycle(screenLifecycle)
 *       .eventListener(new SSEEventListenerAdapter() {
 *         public void onEvent(SSEEvent event) {
 *           render(event.getData());
 *         }
 *       })
 *       .build();
 *   bridge.connectPost("https://example.com/chat", "{\"prompt\":\"hi\"}");
 * </code></pre>
 * Use {@link #getClient()} for anything the facade does not expose.
 */
public final class SSEBridge implements Closeable {
  private final SSEClient client;

  private SSEBridge(SSEClient client) {
    this.client = client;
  }

  /**
   * Connects with a GET request.
   * @param url the stream URL
   * @throws IllegalArgumentException if the URL is blank or not an HTTP or HTTPS URL
   */
  public void connectGet(String url) {
    connect(SSERequest.get(url));
  }

  /**
   * Connects with a GET request.
   * @param url the stream URL
   * @param headers request headers; may be null
   * @throws IllegalArgumentException if the URL is blank or not an HTTP or HTTPS URL, or a
   *   header is invalid
   */
  public void connectGet(String url, Map<String, String> headers) {
    connect(SSERequest.get(url, headers));
  }

  /**
   * Connects with a POST request whose body is sent as JSON.
   * @param url the stream URL
   * @param body the request body
   * @throws IllegalArgumentException if the URL is invalid or the body is null
   */
  public void connectPost(String url, String body) {
    connect(SSERequest.post(url, body));
  }

  /**
   * Connects with a POST request whose body is sent as JSON.
   * @param url the stream URL
   * @param body the request body
   * @param headers request headers; may be null
   * @throws IllegalArgumentException if the URL is invalid, the body is null, or a header is
   *   invalid
   */
  public void connectPost(String url, String body, Map<String, String> headers) {
    connect(SSERequest.post(url, body, headers));
  }

  /**
   * See {@link SSEClient#connect(SSERequest)}.
   * @param request the request
   */
  public void connect(SSERequest request) {
    client.connect(request);
  }

  /**
   * See {@link SSEClient#disconnect()}.
   */
  public void disconnect() {
    client.disconnect();
  }

  /**
   * See {@link SSEClient#isConnecting()}.
   * @return true if connecting or connected
   */
  public boolean isConnecting() {
    return client.isConnecting();
  }

  /**
   * See {@link SSEClient#getState()}.
   * @return the connection state
   */
  public ConnectionState getState() {
    return client.getState();
  }

  /**
   * See {@link SSEClient#setEventListener(SSEEventListener)}.
   * @param listener the new listener, or null
   */
  public void setEventListener(SSEEventListener listener) {
    client.setEventListener(listener);
  }

  /**
   * See {@link SSEClient#close()}.
   */
  @Override
  public void close() {
    client.close();
  }

  /**
   * Returns the underlying client.
   * @return the client
   */
  public SSEClient getClient() {
    return client;
  }

  /**
   * Builder for {@link SSEBridge}. The options are the same as for {@link SSEClient.Builder}.
   */
  public static final class Builder {
    private final SSEClient.Builder clientBuilder = new SSEClient.Builder();

    /**
     * Creates a builder with default settings.
     */
    public Builder() {}

    /**
     * See {@link SSEClient.Builder#config(ClientConfig)}.
     * @param config the configuration, or null for the default
     * @return the builder
     */
    public Builder config(ClientConfig config) {
      clientBuilder.config(config);
      return this;
    }

    /**
     * See {@link SSEClient.Builder#lifecycle(Lifecycle)}.
     * @param lifecycle the owner's lifecycle, or null
     * @return the builder
     */
    public Builder lifecycle(Lifecycle lifecycle) {
      clientBuilder.lifecycle(lifecycle);
      return this;
    }

    /**
     * See {@link SSEClient.Builder#eventListener(SSEEventListener)}.
     * @param listener the listener, or null
     * @return the builder
     */
    public Builder eventListener(SSEEventListener listener) {
      clientBuilder.eventListener(listener);
      return this;
    }

    /**
     * See {@link SSEClient.Builder#addInterceptor(SSEInterceptor)}.
     * @param interceptor the interceptor
     * @return the builder
     */
    public Builder addInterceptor(SSEInterceptor interceptor) {
      clientBuilder.addInterceptor(interceptor);
      return this;
    }

    /**
     * See {@link SSEClient.Builder#logger(LDLogger)}.
     * @param logger the logger, or null
     * @return the builder
     */
    public Builder logger(LDLogger logger) {
      clientBuilder.logger(logger);
      return this;
    }

    /**
     * See {@link SSEClient.Builder#callbackExecutor(Executor)}.
     * @param callbackExecutor the executor, or null
     * @return the builder
     */
    public Builder callbackExecutor(Executor callbackExecutor) {
      clientBuilder.callbackExecutor(callbackExecutor);
      return this;
    }

    /**
     * Creates the facade and its client.
     * @return a new SSEBridge
     */
    public SSEBridge build() {
      return new SSEBridge(clientBuilder.build());
    }
  }
}
