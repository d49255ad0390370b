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

package com.axonops.tracepipe.api;

import com.axonops.tracepipe.config.TracePipeConfig;
import com.axonops.tracepipe.metadata.MetadataEventEncoder;
import com.axonops.tracepipe.metrics.MetricNames;
import com.axonops.tracepipe.metrics.TracePipeMetricsRegistry;
import com.axonops.tracepipe.provider.EventInstance;
import com.axonops.tracepipe.provider.ProviderRegistry;
import com.axonops.tracepipe.provider.RegistryStatistics;
import com.axonops.tracepipe.provider.TraceEvent;
import com.axonops.tracepipe.provider.TraceProvider;
import com.axonops.tracepipe.session.SessionController;
import com.axonops.tracepipe.util.PipeLock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the tracing core.
 *
 * <p>Owns the registry lock, the provider registry, the session controller and the internal
 * configuration provider whose single event carries metadata payloads. Session methods take the
 * lock on behalf of the caller, so application code never handles it directly.
 *
 * <pre>{@code
 * try (TracePipe pipe = TracePipe.create(TracePipeConfig.fromEnvironment())) {
 *   TraceProvider provider = pipe.createProvider("MyCompany-MyComponent").orElseThrow();
 *   pipe.enable(64, List.of(new ProviderConfiguration("MyCompany-MyComponent", 0xFF, EventLevel.INFORMATIONAL)));
 *   ...
 *   pipe.disable();
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TracePipe implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(TracePipe.class);

  private final TracePipeConfig config;
  private final PipeLock lock;
  private final ProviderRegistry registry;
  private final SessionController session;
  private final TraceProvider configProvider;
  private final TraceEvent metadataEvent;
  private volatile boolean shutdown;

  private TracePipe(TracePipeConfig config) {
    this.config = config;
    this.lock = new PipeLock();
    this.registry = new ProviderRegistry(lock, config.metricsRegistry());
    this.session = new SessionController(registry, config);

    this.configProvider =
        registry
            .register(WellKnownProviders.CONFIGURATION_PROVIDER_NAME, null, null)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "TracePipe: configuration provider already registered"));
    this.metadataEvent =
        configProvider.addEvent(
            WellKnownProviders.METADATA_EVENT_ID, 0, 0, EventLevel.LOG_ALWAYS, false, null);

    logger.debug(
        "TracePipe: Initialized - catchAll: {}, default buffer size: {} bytes",
        config.catchAllAtStartup(),
        config.defaultCircularBufferSizeBytes());
  }

  /**
   * Creates a pipe with its configuration provider registered.
   *
   * @param config configuration
   * @return new pipe
   */
  public static TracePipe create(TracePipeConfig config) {
    return new TracePipe(Objects.requireNonNull(config, "config cannot be null"));
  }

  /** Creates a pipe with {@link TracePipeConfig#DEFAULT}. */
  public static TracePipe create() {
    return create(TracePipeConfig.DEFAULT);
  }

  // ========================================
  // Providers
  // ========================================

  /**
   * Creates and registers a provider.
   *
   * @param name unique provider name
   * @param callback notified on configuration changes, may be null
   * @param callbackData handed back to the callback, may be null
   * @return the provider, or empty if the name is already registered
   */
  public Optional<TraceProvider> createProvider(
      String name, ProviderCallback callback, Object callbackData) {
    return registry.register(name, callback, callbackData);
  }

  /** Creates and registers a provider without callback. */
  public Optional<TraceProvider> createProvider(String name) {
    return createProvider(name, null, null);
  }

  /**
   * Deletes a provider.
   *
   * <p>Safe to call from a provider callback: the deletion is then deferred until the running
   * session sweep has finished and completed by the next {@link #disable()}.
   *
   * @param provider provider to delete
   * @return true if deleted now, false if deferred
   */
  public boolean deleteProvider(TraceProvider provider) {
    return registry.delete(provider);
  }

  /**
   * Finds a registered provider.
   *
   * @param name exact provider name
   * @return the provider, or empty
   */
  public Optional<TraceProvider> getProvider(String name) {
    return registry.lookup(name);
  }

  /** The internal provider owning the metadata event. */
  public TraceProvider getConfigurationProvider() {
    return configProvider;
  }

  /** The metadata event descriptor. */
  public TraceEvent getMetadataEvent() {
    return metadataEvent;
  }

  // ========================================
  // Session
  // ========================================

  /**
   * Enables a session.
   *
   * @param circularBufferSizeInMB buffer size in MiB (unsigned)
   * @param providers enable rules
   * @throws IllegalStateException if a session is already enabled or the pipe was shut down
   * @throws IllegalArgumentException if a rule has an unknown level
   */
  public void enable(int circularBufferSizeInMB, List<ProviderConfiguration> providers) {
    try (PipeLock.Held held = lock.acquire()) {
      session.enable(circularBufferSizeInMB, providers);
    }
  }

  /** Disables the current session and completes deferred provider deletions. */
  public void disable() {
    try (PipeLock.Held held = lock.acquire()) {
      session.disable();
    }
  }

  /**
   * Starts a rundown session.
   *
   * @throws IllegalStateException if a session is already enabled or the pipe was shut down
   */
  public void enableRundown() {
    try (PipeLock.Held held = lock.acquire()) {
      session.enableRundown();
    }
  }

  /**
   * Sets the circular buffer size; ignored while a session is enabled.
   *
   * @param bytes size in bytes
   * @throws IllegalArgumentException if {@code bytes} is not positive
   */
  public void setCircularBufferSize(long bytes) {
    try (PipeLock.Held held = lock.acquire()) {
      session.setCircularBufferSize(bytes);
    }
  }

  public long getCircularBufferSize() {
    return session.getCircularBufferSize();
  }

  public boolean isEnabled() {
    return session.isEnabled();
  }

  public boolean isRundownEnabled() {
    return session.isRundownEnabled();
  }

  // ========================================
  // Metadata
  // ========================================

  /**
   * Builds the metadata event describing the event of {@code source}.
   *
   * <p>The result carries the source's timestamp so that it sorts immediately before, or together
   * with, the event it describes.
   *
   * @param source an instance of the event to describe
   * @return metadata event instance on the configuration provider
   */
  public EventInstance buildMetadataEvent(EventInstance source) {
    Objects.requireNonNull(source, "source cannot be null");
    TraceEvent sourceEvent = source.getEvent();
    TracePipeMetricsRegistry metrics = config.metricsRegistry();

    byte[] payload =
        metrics.time(
            MetricNames.METADATA_ENCODE_LATENCY,
            () ->
                MetadataEventEncoder.encode(
                    sourceEvent.getProvider().getName(),
                    sourceEvent.getEventId(),
                    sourceEvent.getEventVersion(),
                    sourceEvent.getMetadata()));
    metrics.incrementCounter(MetricNames.METADATA_EVENTS_BUILT);
    metrics.incrementCounter(MetricNames.METADATA_BYTES, payload.length);

    return new EventInstance(
        metadataEvent, Thread.currentThread().getId(), payload, source.getTimestamp());
  }

  // ========================================
  // Lifecycle
  // ========================================

  public RegistryStatistics getStatistics() {
    return registry.getStatistics();
  }

  /** The underlying registry, for session managers that drive the lock themselves. */
  public ProviderRegistry getRegistry() {
    return registry;
  }

  /** The underlying session controller, for session managers that drive the lock themselves. */
  public SessionController getSessionController() {
    return session;
  }

  /**
   * Releases the configuration provider and the registry.
   *
   * <p>An enabled session is disabled first, in the same lock acquisition as the release.
   *
   * <p>Never throws. If the registry lock cannot be obtained within {@link
   * TracePipeConfig#teardownLockTimeoutMillis()} the structures are leaked and the result says so;
   * callers at process exit may ignore it.
   *
   * @return outcome of the teardown
   */
  public TeardownResult shutdown() {
    if (shutdown) {
      return TeardownResult.released();
    }

    TeardownResult result =
        registry.teardown(config.teardownLockTimeoutMillis(), this::endSession, configProvider);
    if (result.clean()) {
      session.close();
      shutdown = true;
      logger.info("TracePipe: Shut down");
    }
    return result;
  }

  private void endSession() {
    if (session.isEnabled()) {
      logger.info("TracePipe: Disabling active session before shutdown");
      session.disable();
    }
  }

  /** Calls {@link #shutdown()}; an incomplete teardown is logged, not thrown. */
  @Override
  public void close() {
    TeardownResult result = shutdown();
    if (!result.clean()) {
      logger.warn(
          "TracePipe: Teardown incomplete - {} registry entries leaked",
          result.leakedProviders(),
          result.failure());
    }
  }
}
