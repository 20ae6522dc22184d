package com.launchdarkly.ssebridge;

import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;
import com.launchdarkly.logging.Logs;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.ConnectionPool;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Manages one Server-Sent Events connection at a time and reports its progress to an
 * {@link SSEEventListener}.
 * <p>
 * {@link #connect(SSERequest)} returns immediately; the request is sent, and the stream is
 * read, on an OkHttp dispatcher thread. The listener sees the state move through
 * {@link ConnectionState#CONNECTING} and {@link ConnectionState#CONNECTED}, then one
 * {@link SSEEventListener#onEvent(SSEEvent)} per event, and finally exactly one of
 * {@link ConnectionState#CLOSED}, {@link ConnectionState#FAILED} or
 * {@link ConnectionState#CANCELLED}. The client never reconnects by itself; call
 * {@code connect} again to start a new attempt. The same OkHttp client is reused for every
 * attempt.
 * <p>
 * {@link #close()} releases everything, after which the client is unusable and silent. If the
 * client was built with a {@link Lifecycle}, it closes itself when that lifecycle is destroyed.
 * <pre><code>
 *   SSEClient client = new SSEClient.Builder()
 *       .eventListener(myListener)
 *       .logger(LDLogger.withAdapter(Logs.basic(), "stream"))
 *       .build();
 *   client.connect(SSERequest.get("https://example.com/stream"));
 * </code></pre>
 */
public class SSEClient implements Closeable {
  static final String DEFAULT_LOGGER_NAME = "SSEBridge";

  private final ClientConfig config;
  private final Lifecycle lifecycle;
  private final ClientConfigurer clientConfigurer;
  final LDLogger logger; // visible for tests
  private final ConnectionStateMachine stateMachine = new ConnectionStateMachine();
  private final EventDispatcher dispatcher;
  private final Lifecycle.Observer lifecycleObserver = this::close;

  private final Object lock = new Object();
  private final List<SSEInterceptor> interceptors = new ArrayList<>();
  private OkHttpClient httpClient;
  private Call currentCall;
  private volatile boolean closed;

  /**
   * An interface for use with {@link Builder#clientBuilderActions(ClientConfigurer)}.
   */
  public static interface ClientConfigurer {
    /**
     * This method is called with the OkHttp {@link okhttp3.OkHttpClient.Builder} that will be
     * used for the client, after the timeouts and interceptors have been set, allowing you to
     * call any other configuration methods you want.
     * @param builder the client builder
     */
    void configure(OkHttpClient.Builder builder);
  }

  private SSEClient(Builder builder) {
    this.config = builder.config == null ? ClientConfig.DEFAULT : builder.config;
    if (builder.logger != null) {
      this.logger = builder.logger;
    } else if (config.isLoggingEnabled()) {
      this.logger = LDLogger.withAdapter(Logs.basic(), DEFAULT_LOGGER_NAME);
    } else {
      this.logger = LDLogger.none();
    }
    this.clientConfigurer = builder.clientConfigurer;
    this.lifecycle = builder.lifecycle;
    this.interceptors.addAll(builder.interceptors);
    this.dispatcher = new EventDispatcher(builder.callbackExecutor, stateMachine, this::isSuppressed, logger);
    this.dispatcher.setListener(builder.listener);

    if (lifecycle != null) {
      lifecycle.addObserver(lifecycleObserver);
      if (lifecycle.isDestroyed()) {
        close();
      }
    }
  }

  /**
   * Starts a new connection attempt.
   * <p>
   * If an attempt is already in progress ({@link #isConnecting()} is true), this does nothing.
   * If the client has been closed, it logs a warning and does nothing. Otherwise the state
   * becomes {@link ConnectionState#CONNECTING} and the request is queued on the OkHttp
   * dispatcher; this method does not wait for the network.
   *
   * @param request the request to send
   * @throws IllegalArgumentException if the request is null
   */
  public void connect(SSERequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request must not be null");
    }
    long attempt;
    synchronized (lock) {
      if (isSuppressed()) {
        logger.warn("connect() was called after the client was closed; ignoring");
        return;
      }
      attempt = stateMachine.begin();
    }
    if (attempt == ConnectionStateMachine.NO_ATTEMPT) {
      logger.debug("connect() was called while state was {}; ignoring", stateMachine.getState());
      return;
    }
    dispatcher.stateChanged(attempt, ConnectionState.CONNECTING);

    Call call;
    synchronized (lock) {
      if (closed || !stateMachine.isActive(attempt)) {
        return; // disconnected or closed while the CONNECTING callback ran
      }
      logger.debug("Connecting to {}", request.getUrl());
      call = getOrCreateHttpClient().newCall(RequestFactory.create(request));
      currentCall = call;
    }
    call.enqueue(new StreamCallback(attempt));
  }

  /**
   * Ends the current connection attempt, if any.
   * <p>
   * The state becomes {@link ConnectionState#CANCELLED} right away and the listener is told
   * so; the HTTP call is then cancelled, and nothing else from that attempt reaches the
   * listener. If no attempt is in progress, this does nothing.
   */
  public void disconnect() {
    boolean cancelled;
    Call call;
    synchronized (lock) {
      cancelled = stateMachine.cancel();
      call = currentCall;
      currentCall = null;
    }
    if (cancelled) {
      logger.debug("Disconnecting");
      dispatcher.stateChanged(ConnectionState.CANCELLED, null);
    }
    if (call != null) {
      call.cancel();
    }
  }

  /**
   * Returns true if an attempt is in progress: the state is {@link ConnectionState#CONNECTING}
   * or {@link ConnectionState#CONNECTED}.
   *
   * @return true if connecting or connected
   */
  public boolean isConnecting() {
    return stateMachine.getState().isActive();
  }

  /**
   * Returns the current state. This never blocks.
   *
   * @return the connection state
   */
  public ConnectionState getState() {
    return stateMachine.getState();
  }

  /**
   * Replaces the listener. Callbacks that have already started keep using the old one.
   *
   * @param listener the new listener, or null to stop receiving callbacks
   * @return this client
   */
  public SSEClient setEventListener(SSEEventListener listener) {
    if (closed) {
      logger.warn("setEventListener() was called after the client was closed; ignoring");
      return this;
    }
    dispatcher.setListener(listener);
    return this;
  }

  /**
   * Appends an interceptor to the request pipeline.
   * <p>
   * Interceptors are fixed when the OkHttp client is created, which happens on the first
   * {@link #connect(SSERequest)}; add them before that.
   *
   * @param interceptor the interceptor
   * @return this client
   * @throws IllegalArgumentException if the interceptor is null
   * @throws IllegalStateException if the client has already connected once, or has been closed
   */
  public SSEClient addInterceptor(SSEInterceptor interceptor) {
    if (interceptor == null) {
      throw new IllegalArgumentException("interceptor must not be null");
    }
    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("client has been closed");
      }
      if (httpClient != null) {
        throw new IllegalStateException("interceptors must be added before the first connect()");
      }
      interceptors.add(interceptor);
    }
    return this;
  }

  /**
   * Permanently shuts down the client.
   * <p>
   * Any attempt in progress is cancelled without notifying the listener, the listener and
   * interceptors are released, the OkHttp client's dispatcher and connection pool are shut
   * down, and the client stops observing its {@link Lifecycle}. Calling this more than once
   * has no further effect.
   */
  @Override
  public void close() {
    Call call;
    OkHttpClient client;
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      stateMachine.cancel();
      call = currentCall;
      currentCall = null;
      client = httpClient;
      httpClient = null;
      interceptors.clear();
    }
    logger.debug("Closing client");
    dispatcher.setListener(null);
    if (lifecycle != null) {
      lifecycle.removeObserver(lifecycleObserver);
    }
    if (call != null) {
      call.cancel();
    }
    if (client != null) {
      client.dispatcher().cancelAll();
      client.dispatcher().executorService().shutdown();
      client.connectionPool().evictAll();
    }
  }

  boolean isClosed() {
    return closed;
  }

  // visible for tests
  OkHttpClient httpClient() {
    synchronized (lock) {
      return httpClient;
    }
  }

  private boolean isSuppressed() {
    return closed || (lifecycle != null && lifecycle.isDestroyed());
  }

  // called with lock held
  private OkHttpClient getOrCreateHttpClient() {
    if (httpClient == null) {
      OkHttpClient.Builder builder = new OkHttpClient.Builder()
          .connectionPool(new ConnectionPool(1, 1, TimeUnit.SECONDS))
          .connectTimeout(config.getConnectTimeoutMillis(), TimeUnit.MILLISECONDS)
          .readTimeout(config.getReadTimeoutMillis(), TimeUnit.MILLISECONDS)
          .writeTimeout(config.getWriteTimeoutMillis(), TimeUnit.MILLISECONDS)
          .retryOnConnectionFailure(false)
          .addInterceptor(new LoggingInterceptor(logger, config.isLoggingEnabled()))
          .addInterceptor(new HeaderInterceptor());
      for (SSEInterceptor interceptor: interceptors) {
        builder.addInterceptor(interceptor);
      }
      if (clientConfigurer != null) {
        clientConfigurer.configure(builder);
      }
      httpClient = builder.build();
    }
    return httpClient;
  }

  private static boolean isEventStream(MediaType contentType) {
    return contentType != null && "text".equals(contentType.type()) &&
        "event-stream".equals(contentType.subtype());
  }

  private void fail(long attempt, Call call, IOException e) {
    if (!stateMachine.isActive(attempt)) {
      logger.debug("Ignoring error from a connection that has already ended: {}", LogValues.exceptionSummary(e));
      return;
    }
    if (call.isCanceled() || Helpers.isCancellationReset(e)) {
      finish(attempt, call, ConnectionState.CANCELLED, null);
    } else {
      logger.info("Connection failed: {}", LogValues.exceptionSummary(e));
      finish(attempt, call, ConnectionState.FAILED, new StreamIOException(e));
    }
  }

  private void finish(long attempt, Call call, ConnectionState terminal, Throwable error) {
    synchronized (lock) {
      if (currentCall == call) {
        currentCall = null;
      }
    }
    if (stateMachine.finish(attempt, terminal)) {
      dispatcher.stateChanged(terminal, error);
    } else {
      logger.debug("Connection had already ended; not reporting {}", terminal);
    }
  }

  // visible for tests
  final class StreamCallback implements Callback {
    private final long attempt;

    StreamCallback(long attempt) {
      this.attempt = attempt;
    }

    @Override
    public void onFailure(Call call, IOException e) {
      fail(attempt, call, e);
    }

    @Override
    public void onResponse(Call call, Response response) {
      try (Response r = response) {
        if (!r.isSuccessful()) {
          logger.info("Server returned HTTP error {}", r.code());
          finish(attempt, call, ConnectionState.FAILED, new StreamHttpErrorException(r.code()));
          return;
        }
        ResponseBody body = r.body();
        MediaType contentType = body == null ? null : body.contentType();
        if (!isEventStream(contentType)) {
          String type = contentType == null ? null : contentType.toString();
          logger.info("Server returned invalid content-type: {}", type);
          finish(attempt, call, ConnectionState.FAILED, new StreamContentTypeException(type));
          return;
        }
        if (!stateMachine.open(attempt)) {
          logger.debug("Ignoring response for a connection that has already ended");
          return;
        }
        dispatcher.stateChanged(attempt, ConnectionState.CONNECTED);

        EventStreamReader reader = new EventStreamReader(body.byteStream(),
            EventStreamReader.DEFAULT_READ_BUFFER_SIZE, logger);
        SSEEvent event;
        while ((event = reader.nextEvent()) != null) {
          if (!stateMachine.isActive(attempt)) {
            return;
          }
          dispatcher.event(attempt, event);
        }
        finish(attempt, call, ConnectionState.CLOSED, null);
      } catch (IOException e) {
        fail(attempt, call, e);
      }
    }
  }

  /**
   * Builder for {@link SSEClient}.
   */
  public static final class Builder {
    private ClientConfig config;
    private Lifecycle lifecycle;
    private SSEEventListener listener;
    private final List<SSEInterceptor> interceptors = new ArrayList<>();
    private LDLogger logger;
    private Executor callbackExecutor;
    private ClientConfigurer clientConfigurer;

    /**
     * Creates a builder with default settings.
     */
    public Builder() {}

    /**
     * Sets the timeouts and logging switch.
     *
     * @param config the configuration, or null for {@link ClientConfig#DEFAULT}
     * @return the builder
     */
    public Builder config(ClientConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Ties the client to a lifecycle: when it is destroyed, the client closes itself.
     *
     * @param lifecycle the owner's lifecycle, or null
     * @return the builder
     */
    public Builder lifecycle(Lifecycle lifecycle) {
      this.lifecycle = lifecycle;
      return this;
    }

    /**
     * Sets the initial listener.
     *
     * @param listener the listener, or null
     * @return the builder
     */
    public Builder eventListener(SSEEventListener listener) {
      this.listener = listener;
      return this;
    }

    /**
     * Appends an interceptor to the request pipeline.
     *
     * @param interceptor the interceptor
     * @return the builder
     * @throws IllegalArgumentException if the interceptor is null
     */
    public Builder addInterceptor(SSEInterceptor interceptor) {
      if (interceptor == null) {
        throw new IllegalArgumentException("interceptor must not be null");
      }
      interceptors.add(interceptor);
      return this;
    }

    /**
     * Specifies a custom logger.
     * <p>
     * If you do not provide a logger, there is no log output unless
     * {@link ClientConfig#isLoggingEnabled()} is true, in which case output goes to the
     * console with the name "SSEBridge":
     * <pre><code>
     *   builder.logger(LDLogger.withAdapter(Logs.basic(), "logname"));
     * </code></pre>
     *
     * @param logger an {@link LDLogger}, or null for the default
     * @return the builder
     */
    public Builder logger(LDLogger logger) {
      this.logger = logger;
      return this;
    }

    /**
     * Specifies where listener callbacks run. By default they run on the thread that caused
     * them, which is usually an OkHttp dispatcher thread. Use a single-threaded executor to
     * keep callbacks in order.
     *
     * @param callbackExecutor the executor, or null for the default
     * @return the builder
     */
    public Builder callbackExecutor(Executor callbackExecutor) {
      this.callbackExecutor = callbackExecutor;
      return this;
    }

    /**
     * Specifies any other OkHttp settings, such as a proxy or a TLS configuration.
     * <pre><code>
     *   builder.clientBuilderActions(clientBuilder -&gt; {
     *       clientBuilder.proxy(myProxy);
     *     });
     * </code></pre>
     *
     * @param configurer a ClientConfigurer (or lambda) that will act on the HTTP client builder
     * @return the builder
     */
    public Builder clientBuilderActions(ClientConfigurer configurer) {
      this.clientConfigurer = configurer;
      return this;
    }

    /**
     * Creates the client.
     *
     * @return a new client
     */
    public SSEClient build() {
      return new SSEClient(this);
    }
  }
}
