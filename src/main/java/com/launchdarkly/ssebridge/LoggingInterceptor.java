package com.launchdarkly.ssebridge;

import com.launchdarkly.logging.LDLogger;

import java.io.IOException;

import okhttp3.Request;
import okhttp3.Response;

/**
 * Logs the request line of each outgoing request and the status line of its response, at
 * INFO level.
 * <p>
 * {@link SSEClient} always installs this as the first interceptor; it does nothing unless
 * {@link ClientConfig#isLoggingEnabled()} is true. The response body is never read here,
 * since it is a live stream.
 */
public final class LoggingInterceptor implements SSEInterceptor {
  private final LDLogger logger;
  private final boolean enabled;

  /**
   * Creates an instance.
   *
   * @param logger the logger to write to
   * @param enabled false to pass requests through without logging
   */
  public LoggingInterceptor(LDLogger logger, boolean enabled) {
    this.logger = logger == null ? LDLogger.none() : logger;
    this.enabled = enabled;
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!enabled) {
      return chain.proceed(request);
    }
    logger.info("--> {} {}", request.method(), request.url());
    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      logger.info("<-- HTTP FAILED: {}", e.toString());
      throw e;
    }
    logger.info("<-- {} {}", response.code(), response.message());
    return response;
  }
}
