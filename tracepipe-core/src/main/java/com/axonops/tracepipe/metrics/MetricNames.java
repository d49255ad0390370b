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

/**
 * Metric name constants for tracing core instrumentation.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.*})
 * </ul>
 *
 * <p>All names are relative; {@link DropwizardMetricsAdapter} prepends its prefix.
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {
    // Constants
  }

  // ========================================
  // Provider registry
  // ========================================

  /** Providers successfully registered. */
  public static final String PROVIDERS_REGISTERED = "providers.registered.total.count";

  /** Providers removed from the registry, directly or through the deferred sweep. */
  public static final String PROVIDERS_UNREGISTERED = "providers.unregistered.total.count";

  /** Registrations rejected because a provider with the same name was already live. */
  public static final String PROVIDERS_DUPLICATE_REJECTED =
      "providers.duplicate_rejected.total.count";

  /** Deletions requested from inside a sweep and deferred. */
  public static final String PROVIDERS_DELETE_DEFERRED = "providers.delete_deferred.total.count";

  /** Providers currently in the registry (gauge). */
  public static final String PROVIDERS_CURRENT = "providers.registered.current.count";

  /** Providers currently enabled (gauge). */
  public static final String PROVIDERS_ENABLED_CURRENT = "providers.enabled.current.count";

  /** Providers awaiting the deferred-deletion sweep (gauge). */
  public static final String PROVIDERS_DEFERRED_CURRENT = "providers.deferred.current.count";

  // ========================================
  // Session
  // ========================================

  /** Session enable requests, rundown included. */
  public static final String SESSIONS_ENABLED = "sessions.enabled.total.count";

  /** Session disable requests. */
  public static final String SESSIONS_DISABLED = "sessions.disabled.total.count";

  /** Rundown sessions started. */
  public static final String SESSIONS_RUNDOWN = "sessions.rundown.total.count";

  /** Buffer size changes ignored because a session was active. */
  public static final String SESSIONS_BUFFER_RESIZE_IGNORED =
      "sessions.buffer_resize_ignored.total.count";

  /** Time spent sweeping providers on enable/disable. */
  public static final String SESSIONS_SWEEP_LATENCY = "sessions.sweep.latency";

  /** 1 while a session is enabled, 0 otherwise (gauge). */
  public static final String SESSIONS_ACTIVE_CURRENT = "sessions.active.current.count";

  // ========================================
  // Metadata events
  // ========================================

  /** Metadata events built. */
  public static final String METADATA_EVENTS_BUILT = "metadata.events.built.total.count";

  /** Bytes of metadata payload produced. */
  public static final String METADATA_BYTES = "metadata.payload.bytes.total.count";

  /** Time spent encoding metadata payloads. */
  public static final String METADATA_ENCODE_LATENCY = "metadata.encode.latency";

  // ========================================
  // Errors
  // ========================================

  /** Provider callbacks that threw while a configuration was being applied. */
  public static final String ERRORS_CALLBACK_FAILED = "errors.callback_failed.total.count";

  /** Teardown steps that could not acquire the lock and leaked. */
  public static final String ERRORS_TEARDOWN_LEAKED = "errors.teardown_leaked.total.count";
}
