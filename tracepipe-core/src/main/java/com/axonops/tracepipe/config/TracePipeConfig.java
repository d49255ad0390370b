/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.tracepipe.config;

import com.axonops.tracepipe.metrics.NoOpMetricsRegistry;
import com.axonops.tracepipe.metrics.TracePipeMetricsRegistry;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for the tracing core.
 *
 * <p>Immutable. The catch-all flag is read once, when the configuration is built, and handed to
 * every session filter list explicitly.
 *
 * <h2>Catch-all tracing</h2>
 *
 * <p>When {@code catchAllAtStartup} is set every session enables every provider with all keywords
 * at {@link com.axonops.tracepipe.api.EventLevel#VERBOSE}, ignoring the provider list the session
 * manager passes in. {@link #fromEnvironment()} derives it from bit 0 of the system property
 * {@value #PERFORMANCE_TRACING_PROPERTY}, or, if that is absent, the environment variable
 * {@value #PERFORMANCE_TRACING_ENV}.
 *
 * <pre>{@code
 * TracePipeConfig config = TracePipeConfig.builder()
 *     .catchAllAtStartup(false)
 *     .defaultCircularBufferSizeBytes(256L * 1024 * 1024)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.tracing"))
 *     .build();
 * }</pre>
 *
 * @param catchAllAtStartup enable every provider at maximum verbosity for every session
 * @param defaultCircularBufferSizeBytes buffer size reported before any session sets one
 * @param teardownLockTimeoutMillis how long teardown waits for the registry lock before leaking
 * @param metricsRegistry metrics implementation
 * @since 1.0.0
 */
public record TracePipeConfig(
    boolean catchAllAtStartup,
    long defaultCircularBufferSizeBytes,
    long teardownLockTimeoutMillis,
    TracePipeMetricsRegistry metricsRegistry) {

  /** System property carrying the start-up tracing flags. */
  public static final String PERFORMANCE_TRACING_PROPERTY = "tracepipe.performanceTracing";

  /** Environment variable carrying the start-up tracing flags. */
  public static final String PERFORMANCE_TRACING_ENV = "TRACEPIPE_PERFORMANCE_TRACING";

  /** 1000 MiB. */
  public static final long DEFAULT_CIRCULAR_BUFFER_SIZE_BYTES = 1024L * 1024 * 1000;

  public static final long DEFAULT_TEARDOWN_LOCK_TIMEOUT_MILLIS = 5000;

  /** Catch-all off, 1000 MiB buffer, 5s teardown wait, metrics disabled. */
  public static final TracePipeConfig DEFAULT =
      new TracePipeConfig(
          false,
          DEFAULT_CIRCULAR_BUFFER_SIZE_BYTES,
          DEFAULT_TEARDOWN_LOCK_TIMEOUT_MILLIS,
          NoOpMetricsRegistry.INSTANCE);

  public TracePipeConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    if (defaultCircularBufferSizeBytes <= 0) {
      throw new IllegalArgumentException("defaultCircularBufferSizeBytes must be positive");
    }
    if (teardownLockTimeoutMillis < 0) {
      throw new IllegalArgumentException("teardownLockTimeoutMillis must be non-negative");
    }
  }

  /**
   * Builds the default configuration with the catch-all flag taken from the process environment.
   *
   * @return configuration for this process
   * @throws IllegalArgumentException if the flag value is not an integer
   */
  public static TracePipeConfig fromEnvironment() {
    return fromSources(System.getProperties(), System.getenv());
  }

  /**
   * Builds the default configuration with the catch-all flag taken from the given sources.
   *
   * <p>The property wins over the environment. Absent or blank values mean "off".
   *
   * @param properties system properties
   * @param environment environment variables
   * @return configuration derived from the sources
   * @throws IllegalArgumentException if the flag value is not an integer
   */
  public static TracePipeConfig fromSources(
      Properties properties, Map<String, String> environment) {
    String raw = properties.getProperty(PERFORMANCE_TRACING_PROPERTY);
    if (raw == null || raw.isBlank()) {
      raw = environment.get(PERFORMANCE_TRACING_ENV);
    }
    return builder().catchAllAtStartup(parseTracingFlags(raw)).build();
  }

  static boolean parseTracingFlags(String raw) {
    if (raw == null || raw.isBlank()) {
      return false;
    }
    String value = raw.trim();
    try {
      int flags =
          value.startsWith("0x") || value.startsWith("0X")
              ? Integer.parseUnsignedInt(value.substring(2), 16)
              : Integer.parseInt(value);
      return (flags & 1) == 1;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Invalid performance tracing flags '" + raw + "' (expected an integer)", e);
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link TracePipeConfig}. */
  public static class Builder {
    private boolean catchAllAtStartup = false;
    private long defaultCircularBufferSizeBytes = DEFAULT_CIRCULAR_BUFFER_SIZE_BYTES;
    private long teardownLockTimeoutMillis = DEFAULT_TEARDOWN_LOCK_TIMEOUT_MILLIS;
    private TracePipeMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable catch-all tracing for every session.
     *
     * @param catchAll true to ignore session provider lists and enable everything
     * @return this builder
     */
    public Builder catchAllAtStartup(boolean catchAll) {
      this.catchAllAtStartup = catchAll;
      return this;
    }

    /**
     * Set the buffer size reported before any session has configured one.
     *
     * <p><b>Default: 1000 MiB</b>
     *
     * @param bytes size in bytes (must be > 0)
     * @return this builder
     */
    public Builder defaultCircularBufferSizeBytes(long bytes) {
      this.defaultCircularBufferSizeBytes = bytes;
      return this;
    }

    /**
     * Set how long teardown waits for the registry lock.
     *
     * <p><b>Default: 5000ms</b>. Zero means a single non-blocking attempt.
     *
     * @param millis timeout in milliseconds (must be >= 0)
     * @return this builder
     */
    public Builder teardownLockTimeoutMillis(long millis) {
      this.teardownLockTimeoutMillis = millis;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(TracePipeMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public TracePipeConfig build() {
      return new TracePipeConfig(
          catchAllAtStartup,
          defaultCircularBufferSizeBytes,
          teardownLockTimeoutMillis,
          metricsRegistry);
    }
  }
}
