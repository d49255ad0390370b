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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link TracePipeMetricsRegistry} backed by a Dropwizard {@link MetricRegistry}.
 *
 * <p>Every name is qualified as {@code <prefix>.<name>}, e.g. with the default prefix the
 * provider gauge is {@code com.axonops.tracepipe.providers.registered.current.count}. Needs
 * {@code metrics-core}, an optional dependency of this module.
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements TracePipeMetricsRegistry {

  public static final String DEFAULT_PREFIX = "com.axonops.tracepipe";

  private final MetricRegistry registry;
  private final String prefix;

  // Names are a small fixed set; avoids rebuilding them on every sweep
  private final Map<String, String> qualifiedNames = new ConcurrentHashMap<>();

  public DropwizardMetricsAdapter(MetricRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * @param registry destination registry
   * @param prefix namespace prepended to every metric name
   */
  public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
  }

  @Override
  public void incrementCounter(String name) {
    registry.counter(qualify(name)).inc();
  }

  @Override
  public void incrementCounter(String name, long delta) {
    registry.counter(qualify(name)).inc(delta);
  }

  @Override
  public void recordTimer(String name, long durationNanos) {
    registry.timer(qualify(name)).update(durationNanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void registerGauge(String name, Supplier<Number> valueSupplier) {
    String qualified = qualify(name);
    registry.remove(qualified);
    Gauge<Number> gauge = valueSupplier::get;
    registry.register(qualified, gauge);
  }

  @Override
  public void removeGauge(String name) {
    registry.remove(qualify(name));
  }

  private String qualify(String name) {
    return qualifiedNames.computeIfAbsent(name, n -> MetricRegistry.name(prefix, n));
  }
}
