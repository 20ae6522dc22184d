package com.launchdarkly.ssebridge;

import java.util.concurrent.TimeUnit;

/**
 * Transport settings for an {@link SSEClient}: the OkHttp connect, read and write timeouts,
 * and whether requests and responses are logged.
 * <p>
 * Instances are immutable. Use {@link #DEFAULT}, or {@link #builder()} to specify other
 * values:
 * <pre><code>
 *   ClientConfig config = ClientConfig.builder()
 *       .connectTimeout(10)
 *       .readTimeout(60)
 *       .timeUnit(TimeUnit.SECONDS)
 *       .enableLogging(true)
 *       .build();
 * </code></pre>
 * <p>
 * The default timeouts are measured in minutes, which is coarse for a streaming client; most
 * applications will want to set their own.
 */
public final class ClientConfig {
  /**
   * The default value for {@link Builder#connectTimeout(long)}: 1, in {@link #DEFAULT_TIME_UNIT}.
   */
  public static final long DEFAULT_CONNECT_TIMEOUT = 1;
  /**
   * The default value for {@link Builder#readTimeout(long)}: 2, in {@link #DEFAULT_TIME_UNIT}.
   */
  public static final long DEFAULT_READ_TIMEOUT = 2;
  /**
   * The default value for {@link Builder#writeTimeout(long)}: 1, in {@link #DEFAULT_TIME_UNIT}.
   */
  public static final long DEFAULT_WRITE_TIMEOUT = 1;
  /**
   * The default value for {@link Builder#timeUnit(TimeUnit)}: minutes.
   */
  public static final TimeUnit DEFAULT_TIME_UNIT = TimeUnit.MINUTES;

  /**
   * A configuration with all default values.
   */
  public static final ClientConfig DEFAULT = builder().build();

  private final long connectTimeout;
  private final long readTimeout;
  private final long writeTimeout;
  private final TimeUnit timeUnit;
  private final boolean enableLogging;

  private ClientConfig(Builder builder) {
    this.connectTimeout = builder.connectTimeout;
    this.readTimeout = builder.readTimeout;
    this.writeTimeout = builder.writeTimeout;
    this.timeUnit = builder.timeUnit;
    this.enableLogging = builder.enableLogging;
  }

  /**
   * Creates a builder with all properties set to their defaults.
   *
   * @return a builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the connect timeout, in {@link #getTimeUnit()}.
   * @return the connect timeout
   */
  public long getConnectTimeout() {
    return connectTimeout;
  }

  /**
   * Returns the read timeout, in {@link #getTimeUnit()}. A stream that sends nothing for this
   * long fails with a {@link StreamIOException}.
   * @return the read timeout
   */
  public long getReadTimeout() {
    return readTimeout;
  }

  /**
   * Returns the write timeout, in {@link #getTimeUnit()}.
   * @return the write timeout
   */
  public long getWriteTimeout() {
    return writeTimeout;
  }

  /**
   * Returns the unit of all three timeouts.
   * @return the time unit
   */
  public TimeUnit getTimeUnit() {
    return timeUnit;
  }

  /**
   * Returns true if {@link LoggingInterceptor} should log each request and response.
   * @return true if logging is enabled
   */
  public boolean isLoggingEnabled() {
    return enableLogging;
  }

  long getConnectTimeoutMillis() {
    return timeUnit.toMillis(connectTimeout);
  }

  long getReadTimeoutMillis() {
    return timeUnit.toMillis(readTimeout);
  }

  long getWriteTimeoutMillis() {
    return timeUnit.toMillis(writeTimeout);
  }

  @Override
  public String toString() {
    return "ClientConfig(connectTimeout=" + connectTimeout + ",readTimeout=" + readTimeout +
        ",writeTimeout=" + writeTimeout + ",timeUnit=" + timeUnit + ",enableLogging=" + enableLogging + ")";
  }

  /**
   * Builder for {@link ClientConfig}.
   */
  public static final class Builder {
    private long connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private long readTimeout = DEFAULT_READ_TIMEOUT;
    private long writeTimeout = DEFAULT_WRITE_TIMEOUT;
    private TimeUnit timeUnit = DEFAULT_TIME_UNIT;
    private boolean enableLogging;

    private Builder() {}

    /**
     * Sets the connect timeout. Zero means no timeout.
     *
     * @param connectTimeout the timeout, in the unit set by {@link #timeUnit(TimeUnit)}
     * @return the builder
     * @see ClientConfig#DEFAULT_CONNECT_TIMEOUT
     */
    public Builder connectTimeout(long connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    /**
     * Sets the read timeout. Zero means no timeout.
     *
     * @param readTimeout the timeout, in the unit set by {@link #timeUnit(TimeUnit)}
     * @return the builder
     * @see ClientConfig#DEFAULT_READ_TIMEOUT
     */
    public Builder readTimeout(long readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    /**
     * Sets the write timeout. Zero means no timeout.
     *
     * @param writeTimeout the timeout, in the unit set by {@link #timeUnit(TimeUnit)}
     * @return the builder
     * @see ClientConfig#DEFAULT_WRITE_TIMEOUT
     */
    public Builder writeTimeout(long writeTimeout) {
      this.writeTimeout = writeTimeout;
      return this;
    }

    /**
     * Sets the unit for all three timeouts.
     *
     * @param timeUnit the time unit
     * @return the builder
     * @see ClientConfig#DEFAULT_TIME_UNIT
     */
    public Builder timeUnit(TimeUnit timeUnit) {
      this.timeUnit = timeUnit;
      return this;
    }

    /**
     * Specifies whether each request and response line should be logged.
     *
     * @param enableLogging true to log requests and responses
     * @return the builder
     */
    public Builder enableLogging(boolean enableLogging) {
      this.enableLogging = enableLogging;
      return this;
    }

    /**
     * Validates the properties and creates the configuration.
     *
     * @return the configuration
     * @throws IllegalArgumentException if a timeout is negative or the time unit is null
     */
    public ClientConfig build() {
      if (connectTimeout < 0 || readTimeout < 0 || writeTimeout < 0) {
        throw new IllegalArgumentException("timeouts must not be negative");
      }
      if (timeUnit == null) {
        throw new IllegalArgumentException("timeUnit must not be null");
      }
      return new ClientConfig(this);
    }
  }
}
