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

package com.axonops.tracepipe.dropwizard;

import com.axonops.tracepipe.config.TracePipeConfig;
import com.axonops.tracepipe.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link TracePipeConfig} instances that publish to a Dropwizard {@link MetricRegistry}.
 *
 * <p>By default each registry handed in is also exposed over JMX, under the {@code metrics}
 * domain, through one {@link JmxReporter} per registry:
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * try (TracePipe pipe = TracePipe.create(TracePipeMetricsConfig.withMetrics(registry, "com.myapp.tracing"))) {
 *   // MBean metrics:name=com.myapp.tracing.providers.registered.current.count,type=gauges
 * }
 * TracePipeMetricsConfig.shutdown();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class TracePipeMetricsConfig {
  private static final Logger logger = LoggerFactory.getLogger(TracePipeMetricsConfig.class);

  // Guarded by the class monitor
  private static final Map<MetricRegistry, JmxReporter> reporters = new IdentityHashMap<>();

  private TracePipeMetricsConfig() {}

  /** Metrics under {@link DropwizardMetricsAdapter#DEFAULT_PREFIX}, exposed over JMX. */
  public static TracePipeConfig withMetrics(MetricRegistry registry) {
    return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
  }

  /** Metrics under {@code metricPrefix}, exposed over JMX. */
  public static TracePipeConfig withMetrics(MetricRegistry registry, String metricPrefix) {
    return withMetrics(registry, metricPrefix, true);
  }

  /**
   * @param registry destination registry
   * @param metricPrefix namespace of every tracing metric
   * @param enableJmx whether to expose {@code registry} over JMX
   */
  public static TracePipeConfig withMetrics(
      MetricRegistry registry, String metricPrefix, boolean enableJmx) {
    return builderWithMetrics(registry, metricPrefix, enableJmx).build();
  }

  /**
   * Same as {@link #withMetrics(MetricRegistry, String, boolean)} but returns the builder, so
   * catch-all mode or the buffer size can still be set.
   */
  public static TracePipeConfig.Builder builderWithMetrics(
      MetricRegistry registry, String metricPrefix, boolean enableJmx) {
    DropwizardMetricsAdapter adapter = new DropwizardMetricsAdapter(registry, metricPrefix);
    if (enableJmx) {
      exposeViaJmx(registry);
    }
    return TracePipeConfig.builder().metricsRegistry(adapter);
  }

  /** Whether any registry is currently exposed over JMX by this class. */
  public static synchronized boolean isJmxReporterRunning() {
    return !reporters.isEmpty();
  }

  /** Whether {@code registry} is currently exposed over JMX by this class. */
  public static synchronized boolean isJmxReporterRunning(MetricRegistry registry) {
    return reporters.containsKey(registry);
  }

  private static synchronized void exposeViaJmx(MetricRegistry registry) {
    if (reporters.containsKey(registry)) {
      return;
    }
    try {
      JmxReporter reporter = JmxReporter.forRegistry(registry).build();
      reporter.start();
      reporters.put(registry, reporter);
      logger.info("TracePipe: JmxReporter started - {} registries exposed", reporters.size());
    } catch (RuntimeException e) {
      // Metrics still reach the registry; only the MBeans are missing
      logger.warn("TracePipe: Could not start JmxReporter, metrics not exposed via JMX", e);
    }
  }

  /** Stops every JMX reporter started by this class. */
  public static synchronized void shutdown() {
    if (reporters.isEmpty()) {
      return;
    }
    logger.info("TracePipe: Stopping {} JmxReporter(s)", reporters.size());
    reporters.values().forEach(JmxReporter::stop);
    reporters.clear();
  }
}
