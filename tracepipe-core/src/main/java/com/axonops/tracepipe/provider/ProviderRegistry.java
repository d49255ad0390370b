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

package com.axonops.tracepipe.provider;

import com.axonops.tracepipe.api.EventLevel;
import com.axonops.tracepipe.api.ProviderCallback;
import com.axonops.tracepipe.api.ResourceException;
import com.axonops.tracepipe.api.TeardownResult;
import com.axonops.tracepipe.metrics.MetricNames;
import com.axonops.tracepipe.metrics.TracePipeMetricsRegistry;
import com.axonops.tracepipe.session.EnabledProviderFilter;
import com.axonops.tracepipe.session.EnabledProviderFilterList;
import com.axonops.tracepipe.util.PipeLock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Set of live trace providers, guarded by a single {@link PipeLock}.
 *
 * <p>The same lock guards the filter list of the active session, so a provider registering after
 * a session started is matched against it atomically with its insertion.
 *
 * <p>Locking conventions:
 *
 * <ul>
 *   <li>Plain methods ({@link #register}, {@link #unregister}, {@link #lookup}, {@link #forEach})
 *       acquire the lock themselves and fail if the caller already holds it.
 *   <li>{@code NoLock} methods and {@link #sweepDeferredDeletions()} require the caller to hold
 *       the lock; calling them without it is an {@link IllegalStateException}.
 * </ul>
 *
 * <h2>Deferred deletion</h2>
 *
 * <p>A provider callback runs while a sweep holds the lock. If it asks for its own provider to be
 * deleted, {@link #delete} cannot take the lock, so it only flags the entry. Sweeps skip flagged
 * entries, and {@link #sweepDeferredDeletions()} removes them once the triggering sweep is done.
 *
 * <p>The list is copy-on-write: iteration works on a snapshot, so entries can be removed while a
 * sweep walks the list, and gauges can read it without the lock.
 *
 * @since 1.0.0
 */
public final class ProviderRegistry {
  private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

  private final PipeLock lock;
  private final TracePipeMetricsRegistry metrics;

  // Guarded by lock for writes
  private final List<TraceProvider> providers = new CopyOnWriteArrayList<>();
  private EnabledProviderFilterList enabledFilters;
  private volatile boolean tornDown;

  private final LongAdder totalRegistered = new LongAdder();
  private final LongAdder totalUnregistered = new LongAdder();
  private final LongAdder duplicatesRejected = new LongAdder();
  private final LongAdder deferredCompleted = new LongAdder();

  public ProviderRegistry(PipeLock lock, TracePipeMetricsRegistry metrics) {
    this.lock = Objects.requireNonNull(lock, "lock cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    registerRegistryMetrics();
  }

  public PipeLock getLock() {
    return lock;
  }

  /**
   * Registers a new provider.
   *
   * <p>If a session is enabled and its filter list matches the name, the provider is enabled
   * before this method returns.
   *
   * @param name unique provider name (case-sensitive)
   * @param callback configuration-change callback, may be null
   * @param callbackData opaque data handed back to the callback, may be null
   * @return the new provider, or empty if a provider with this name is already registered
   * @throws IllegalStateException if the caller holds the lock or the registry was torn down
   */
  public Optional<TraceProvider> register(
      String name, ProviderCallback callback, Object callbackData) {
    Objects.requireNonNull(name, "name cannot be null");

    try (PipeLock.Held held = lock.acquire()) {
      checkNotTornDown();

      if (lookupNoLock(name).isPresent()) {
        duplicatesRejected.increment();
        metrics.incrementCounter(MetricNames.PROVIDERS_DUPLICATE_REJECTED);
        logger.debug("TracePipe: Provider '{}' is already registered", name);
        return Optional.empty();
      }

      TraceProvider provider = new TraceProvider(name, callback, callbackData);
      providers.add(provider);
      totalRegistered.increment();
      metrics.incrementCounter(MetricNames.PROVIDERS_REGISTERED);

      if (enabledFilters != null) {
        Optional<EnabledProviderFilter> match = enabledFilters.matchProvider(name);
        if (match.isPresent()) {
          EnabledProviderFilter filter = match.get();
          configureNoLock(provider, true, filter.keywords(), filter.level());
        }
      }

      logger.trace("TracePipe: Provider registered - {}", provider);
      return Optional.of(provider);
    }
  }

  /**
   * Removes a provider from the registry.
   *
   * <p>Only the registry entry is removed; the provider object stays usable by its owner.
   *
   * @param provider provider to remove
   * @return true if the provider was registered and has been removed
   * @throws IllegalStateException if the caller holds the lock
   */
  public boolean unregister(TraceProvider provider) {
    Objects.requireNonNull(provider, "provider cannot be null");
    try (PipeLock.Held held = lock.acquire()) {
      return unregisterNoLock(provider);
    }
  }

  /**
   * Deletes a provider: unregisters it and destroys its registry-side record.
   *
   * <p>If the calling thread already holds the lock (a callback running inside a sweep) the
   * provider is only flagged; {@link #sweepDeferredDeletions()} completes the deletion later.
   *
   * @param provider provider to delete
   * @return true if deleted now, false if the deletion was deferred
   */
  public boolean delete(TraceProvider provider) {
    Objects.requireNonNull(provider, "provider cannot be null");

    if (lock.isHeldByCurrentThread()) {
      if (!provider.isDeleteDeferred()) {
        provider.markDeleteDeferred();
        metrics.incrementCounter(MetricNames.PROVIDERS_DELETE_DEFERRED);
        logger.debug(
            "TracePipe: Provider '{}' deletion deferred - registry lock held by caller",
            provider.getName());
      }
      return false;
    }

    unregister(provider);
    provider.destroy();
    return true;
  }

  /**
   * Finds a provider by exact name.
   *
   * @param name provider name
   * @return the provider, or empty if none is registered under that name
   * @throws IllegalStateException if the caller holds the lock
   */
  public Optional<TraceProvider> lookup(String name) {
    try (PipeLock.Held held = lock.acquire()) {
      return lookupNoLock(name);
    }
  }

  /**
   * Finds a provider by exact name. Caller must hold the lock.
   *
   * <p>Providers with a pending deferred deletion are still found until the sweep removes them.
   *
   * @param name provider name
   * @return the provider, or empty
   * @throws IllegalStateException if the caller does not hold the lock
   */
  public Optional<TraceProvider> lookupNoLock(String name) {
    lock.assertHeld("lookupNoLock");
    Objects.requireNonNull(name, "name cannot be null");
    for (TraceProvider provider : providers) {
      if (provider.getName().equals(name)) {
        return Optional.of(provider);
      }
    }
    return Optional.empty();
  }

  /**
   * Applies {@code action} to every live provider while holding the lock.
   *
   * @throws IllegalStateException if the caller holds the lock
   */
  public void forEach(Consumer<TraceProvider> action) {
    try (PipeLock.Held held = lock.acquire()) {
      forEachNoLock(action);
    }
  }

  /**
   * Applies {@code action} to every live provider. Caller must hold the lock.
   *
   * <p>Providers flagged for deferred deletion are skipped.
   */
  public void forEachNoLock(Consumer<TraceProvider> action) {
    lock.assertHeld("forEachNoLock");
    for (TraceProvider provider : providers) {
      if (!provider.isDeleteDeferred()) {
        action.accept(provider);
      }
    }
  }

  /**
   * Sets a provider's filter state and runs its callback. Caller must hold the lock.
   *
   * <p>A throwing callback is logged and counted; the new state is kept.
   */
  public void configureNoLock(
      TraceProvider provider, boolean enabled, long keywords, EventLevel level) {
    lock.assertHeld("configureNoLock");
    try {
      provider.setConfiguration(enabled, keywords, level);
      logger.trace("TracePipe: Provider configured - {}", provider);
    } catch (RuntimeException e) {
      metrics.incrementCounter(MetricNames.ERRORS_CALLBACK_FAILED);
      logger.warn(
          "TracePipe: Callback of provider '{}' failed while applying configuration",
          provider.getName(),
          e);
    }
  }

  /**
   * Completes every deferred deletion. Caller must hold the lock.
   *
   * @return number of providers deleted
   */
  public int sweepDeferredDeletions() {
    lock.assertHeld("sweepDeferredDeletions");

    int deleted = 0;
    // Snapshot iteration: removal below does not disturb the walk
    for (TraceProvider provider : providers) {
      if (provider.isDeleteDeferred()) {
        unregisterNoLock(provider);
        provider.destroy();
        deferredCompleted.increment();
        deleted++;
        logger.trace("TracePipe: Deferred deletion completed - {}", provider.getName());
      }
    }

    if (deleted > 0) {
      logger.debug("TracePipe: Deferred deletion sweep removed {} providers", deleted);
    }
    return deleted;
  }

  /** Installs the filter list of a newly enabled session. Caller must hold the lock. */
  public void installFiltersNoLock(EnabledProviderFilterList filters) {
    lock.assertHeld("installFiltersNoLock");
    this.enabledFilters = Objects.requireNonNull(filters, "filters cannot be null");
  }

  /** Drops the session filter list. Caller must hold the lock. */
  public void clearFiltersNoLock() {
    lock.assertHeld("clearFiltersNoLock");
    this.enabledFilters = null;
  }

  /** Filter list of the active session, empty when none is enabled. Caller must hold the lock. */
  public Optional<EnabledProviderFilterList> enabledFiltersNoLock() {
    lock.assertHeld("enabledFiltersNoLock");
    return Optional.ofNullable(enabledFilters);
  }

  /** Number of registry entries, deferred ones included. Lock-free snapshot. */
  public int size() {
    return providers.size();
  }

  /** Gets registry statistics snapshot (lock-free). */
  public RegistryStatistics getStatistics() {
    int registered = 0;
    int enabled = 0;
    int deferred = 0;
    for (TraceProvider provider : providers) {
      registered++;
      if (provider.isEnabled()) {
        enabled++;
      }
      if (provider.isDeleteDeferred()) {
        deferred++;
      }
    }
    return new RegistryStatistics(
        registered,
        enabled,
        deferred,
        totalRegistered.sum(),
        totalUnregistered.sum(),
        duplicatesRejected.sum(),
        deferredCompleted.sum());
  }

  /**
   * Releases the provider list and filter list.
   *
   * <p>Never throws. If the lock cannot be acquired within the timeout (or the caller already
   * holds it) nothing is released and the failure is reported in the result. Providers are only
   * unlinked, not destroyed, since their owners may still be using them; the exception is {@code
   * ownedProviders}, which belong to the caller and are destroyed as well.
   *
   * @param timeoutMillis maximum wait for the lock
   * @param ownedProviders providers owned by the tearing-down component
   * @return outcome of the teardown
   */
  public TeardownResult teardown(long timeoutMillis, TraceProvider... ownedProviders) {
    return teardown(timeoutMillis, () -> {}, ownedProviders);
  }

  /**
   * Like {@link #teardown(long, TraceProvider...)}, running {@code whileLocked} first in the same
   * lock acquisition. Used to end an active session before its filter list is dropped.
   *
   * @param timeoutMillis maximum wait for the lock
   * @param whileLocked action run with the lock held, before anything is released
   * @param ownedProviders providers owned by the tearing-down component
   * @return outcome of the teardown
   */
  public TeardownResult teardown(
      long timeoutMillis, Runnable whileLocked, TraceProvider... ownedProviders) {
    if (tornDown) {
      return TeardownResult.released();
    }

    Optional<PipeLock.Held> acquired;
    try {
      acquired = lock.tryAcquire(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return leak(new ResourceException("interrupted while waiting for registry lock", e));
    } catch (IllegalStateException e) {
      return leak(
          new ResourceException("registry lock already held by the tearing-down thread", e));
    }

    if (acquired.isEmpty()) {
      return leak(
          new ResourceException(
              "registry lock not acquired within " + timeoutMillis + "ms during teardown"));
    }

    try (PipeLock.Held held = acquired.get()) {
      whileLocked.run();
      for (TraceProvider owned : ownedProviders) {
        unregisterNoLock(owned);
        owned.destroy();
      }
      int released = providers.size();
      providers.clear();
      enabledFilters = null;
      tornDown = true;
      unregisterRegistryMetrics();
      logger.debug("TracePipe: Registry torn down - released {} entries", released);
      return TeardownResult.released();
    }
  }

  public boolean isTornDown() {
    return tornDown;
  }

  private boolean unregisterNoLock(TraceProvider provider) {
    boolean removed = providers.remove(provider);
    if (removed) {
      totalUnregistered.increment();
      metrics.incrementCounter(MetricNames.PROVIDERS_UNREGISTERED);
      logger.trace("TracePipe: Provider unregistered - {}", provider.getName());
    }
    return removed;
  }

  private TeardownResult leak(ResourceException cause) {
    metrics.incrementCounter(MetricNames.ERRORS_TEARDOWN_LEAKED);
    logger.warn(
        "TracePipe: Leaking {} registry entries - {}", providers.size(), cause.getMessage());
    return TeardownResult.leaked(providers.size(), cause);
  }

  private void checkNotTornDown() {
    if (tornDown) {
      throw new IllegalStateException("TracePipe: provider registry has been torn down");
    }
  }

  private void registerRegistryMetrics() {
    metrics.registerGauge(MetricNames.PROVIDERS_CURRENT, providers::size);
    metrics.registerGauge(
        MetricNames.PROVIDERS_ENABLED_CURRENT, () -> getStatistics().enabledProviders());
    metrics.registerGauge(
        MetricNames.PROVIDERS_DEFERRED_CURRENT, () -> getStatistics().deferredDeletionsPending());
  }

  private void unregisterRegistryMetrics() {
    metrics.removeGauges(
        MetricNames.PROVIDERS_CURRENT,
        MetricNames.PROVIDERS_ENABLED_CURRENT,
        MetricNames.PROVIDERS_DEFERRED_CURRENT);
  }
}
