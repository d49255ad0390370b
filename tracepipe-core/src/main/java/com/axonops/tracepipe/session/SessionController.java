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

package com.axonops.tracepipe.session;

import com.axonops.tracepipe.api.EventLevel;
import com.axonops.tracepipe.api.ProviderConfiguration;
import com.axonops.tracepipe.api.WellKnownProviders;
import com.axonops.tracepipe.config.TracePipeConfig;
import com.axonops.tracepipe.metrics.MetricNames;
import com.axonops.tracepipe.metrics.TracePipeMetricsRegistry;
import com.axonops.tracepipe.provider.ProviderRegistry;
import com.axonops.tracepipe.util.PipeLock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session state machine: enable, disable and rundown.
 *
 * <p>States are Disabled, Enabled and RundownEnabled. Enabled and RundownEnabled are entered only
 * from Disabled and always return to Disabled. Every transition runs with the registry lock held
 * by the caller (the session manager), which makes the filter-list swap and the provider sweep
 * one atomic step for registering providers.
 *
 * @since 1.0.0
 */
public final class SessionController {
  private static final Logger logger = LoggerFactory.getLogger(SessionController.class);

  private static final long BYTES_PER_MB = 1024L * 1024;

  /** Rundown events are written synchronously, so the buffer size is nominal. */
  private static final int RUNDOWN_BUFFER_SIZE_MB = 1;

  private final PipeLock lock;
  private final ProviderRegistry registry;
  private final boolean catchAll;
  private final TracePipeMetricsRegistry metrics;

  // Written under lock, readable without it
  private volatile boolean enabled;
  private volatile boolean rundownEnabled;
  private volatile long circularBufferSizeBytes;

  public SessionController(ProviderRegistry registry, TracePipeConfig config) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.lock = registry.getLock();
    this.catchAll = config.catchAllAtStartup();
    this.metrics = config.metricsRegistry();
    this.circularBufferSizeBytes = config.defaultCircularBufferSizeBytes();

    metrics.registerGauge(MetricNames.SESSIONS_ACTIVE_CURRENT, () -> enabled ? 1 : 0);
  }

  /**
   * Starts a session.
   *
   * <p>Sets the buffer size, installs the filter list and enables every registered provider the
   * list matches. Providers without a match keep their current (disabled) state.
   *
   * @param circularBufferSizeInMB buffer size in MiB, interpreted as unsigned 32-bit
   * @param providers enable rules; ignored when catch-all tracing is configured
   * @throws IllegalStateException if the caller does not hold the lock, a session is enabled or
   *     the registry has been torn down
   * @throws IllegalArgumentException if a rule carries an unknown level value
   */
  public void enable(int circularBufferSizeInMB, List<ProviderConfiguration> providers) {
    lock.assertHeld("enable");
    checkNotTornDown();
    if (enabled) {
      throw new IllegalStateException("TracePipe: a session is already enabled");
    }

    EnabledProviderFilterList filters = EnabledProviderFilterList.of(providers, catchAll);

    circularBufferSizeBytes = Integer.toUnsignedLong(circularBufferSizeInMB) * BYTES_PER_MB;
    registry.installFiltersNoLock(filters);
    enabled = true;

    long start = System.nanoTime();
    AtomicInteger matched = new AtomicInteger();
    registry.forEachNoLock(
        provider ->
            filters
                .matchProvider(provider.getName())
                .ifPresent(
                    filter -> {
                      registry.configureNoLock(provider, true, filter.keywords(), filter.level());
                      matched.incrementAndGet();
                    }));
    metrics.recordTimer(MetricNames.SESSIONS_SWEEP_LATENCY, System.nanoTime() - start);
    metrics.incrementCounter(MetricNames.SESSIONS_ENABLED);

    logger.info(
        "TracePipe: Session enabled - bufferSize: {} bytes, rules: {}, catchAll: {}, providers enabled: {}",
        circularBufferSizeBytes,
        filters.size(),
        filters.isCatchAll(),
        matched.get());
  }

  /**
   * Stops the session.
   *
   * <p>Every provider is set to disabled with no keywords at {@link EventLevel#CRITICAL}, the
   * filter list is dropped and deferred provider deletions are completed.
   *
   * @throws IllegalStateException if the caller does not hold the lock
   */
  public void disable() {
    lock.assertHeld("disable");

    long start = System.nanoTime();
    registry.forEachNoLock(
        provider -> registry.configureNoLock(provider, false, 0, EventLevel.CRITICAL));
    metrics.recordTimer(MetricNames.SESSIONS_SWEEP_LATENCY, System.nanoTime() - start);

    boolean wasRundown = rundownEnabled;
    enabled = false;
    rundownEnabled = false;
    registry.clearFiltersNoLock();

    int deleted = registry.sweepDeferredDeletions();
    metrics.incrementCounter(MetricNames.SESSIONS_DISABLED);

    logger.info(
        "TracePipe: Session disabled - rundown: {}, deferred providers deleted: {}",
        wasRundown,
        deleted);
  }

  /**
   * Starts a rundown session on the two runtime rundown providers.
   *
   * @throws IllegalStateException if the caller does not hold the lock or a filter list is
   *     already installed
   */
  public void enableRundown() {
    lock.assertHeld("enableRundown");
    checkNotTornDown();
    if (registry.enabledFiltersNoLock().isPresent()) {
      throw new IllegalStateException(
          "TracePipe: rundown can only be enabled while no session is enabled");
    }

    List<ProviderConfiguration> rundownProviders =
        List.of(
            new ProviderConfiguration(
                WellKnownProviders.RUNTIME_PROVIDER_NAME,
                WellKnownProviders.RUNDOWN_KEYWORDS,
                EventLevel.VERBOSE),
            new ProviderConfiguration(
                WellKnownProviders.RUNDOWN_PROVIDER_NAME,
                WellKnownProviders.RUNDOWN_KEYWORDS,
                EventLevel.VERBOSE));

    rundownEnabled = true;
    metrics.incrementCounter(MetricNames.SESSIONS_RUNDOWN);
    logger.info("TracePipe: Enabling rundown");

    enable(RUNDOWN_BUFFER_SIZE_MB, rundownProviders);
  }

  /**
   * Sets the circular buffer size.
   *
   * <p>Silently ignored while a session is enabled.
   *
   * @param bytes new size in bytes (must be > 0)
   * @throws IllegalStateException if the caller does not hold the lock
   * @throws IllegalArgumentException if {@code bytes} is not positive
   */
  public void setCircularBufferSize(long bytes) {
    lock.assertHeld("setCircularBufferSize");
    if (bytes <= 0) {
      throw new IllegalArgumentException("circular buffer size must be positive: " + bytes);
    }
    if (enabled) {
      metrics.incrementCounter(MetricNames.SESSIONS_BUFFER_RESIZE_IGNORED);
      logger.debug(
          "TracePipe: Ignoring buffer size change to {} bytes - session enabled", bytes);
      return;
    }
    circularBufferSizeBytes = bytes;
  }

  public long getCircularBufferSize() {
    return circularBufferSizeBytes;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public boolean isRundownEnabled() {
    return rundownEnabled;
  }

  private void checkNotTornDown() {
    if (registry.isTornDown()) {
      throw new IllegalStateException("TracePipe: provider registry has been torn down");
    }
  }

  /** Unregisters session gauges. */
  public void close() {
    metrics.removeGauge(MetricNames.SESSIONS_ACTIVE_CURRENT);
  }
}
