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

package com.axonops.tracepipe.metrics;

import java.util.function.Supplier;

/**
 * Sink for the counters, timers and gauges emitted by the registry, the session controller and
 * the metadata encoder path.
 *
 * <p>Called from under the registry lock, so implementations must be thread-safe and must not
 * block. Names are the unqualified constants of {@link MetricNames}; qualifying them (prefix,
 * tags) is up to the implementation.
 *
 * @since 1.0.0
 */
public interface TracePipeMetricsRegistry {

  /** Adds one to the named counter. */
  void incrementCounter(String name);

  /** Adds {@code delta} (non-negative) to the named counter. */
  void incrementCounter(String name, long delta);

  /** Records one duration, in nanoseconds, on the named timer. */
  void recordTimer(String name, long durationNanos);

  /**
   * Publishes a gauge read on demand from {@code valueSupplier}.
   *
   * <p>A gauge already registered under {@code name} is replaced, so a pipe created after another
   * one was shut down reports its own state.
   */
  void registerGauge(String name, Supplier<Number> valueSupplier);

  /** Withdraws a gauge; unknown names are ignored. */
  void removeGauge(String name);

  /**
   * Runs {@code action} and records its duration on the named timer.
   *
   * @return the action's result
   */
  default <T> T time(String name, Supplier<T> action) {
    long start = System.nanoTime();
    try {
      return action.get();
    } finally {
      recordTimer(name, System.nanoTime() - start);
    }
  }

  /** Withdraws several gauges at once. */
  default void removeGauges(String... names) {
    for (String name : names) {
      removeGauge(name);
    }
  }
}
