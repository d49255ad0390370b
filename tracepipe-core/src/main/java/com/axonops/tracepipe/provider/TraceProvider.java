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
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A registered trace provider and its current filter state.
 *
 * <p>Created through {@link ProviderRegistry#register}. The filter state is published as one
 * immutable snapshot so threads emitting events can read it without taking the registry lock.
 * Mutations happen under the lock, from session sweeps or late registration.
 *
 * @since 1.0.0
 */
public final class TraceProvider {

  private final String name;
  private final ProviderCallback callback;
  private final Object callbackData;
  private final List<TraceEvent> events = new CopyOnWriteArrayList<>();

  private volatile FilterState state = FilterState.DISABLED;
  private volatile boolean deleteDeferred;
  private volatile boolean destroyed;

  TraceProvider(String name, ProviderCallback callback, Object callbackData) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.callback = callback;
    this.callbackData = callbackData;
  }

  public String getName() {
    return name;
  }

  public boolean isEnabled() {
    return state.enabled();
  }

  public long getKeywords() {
    return state.keywords();
  }

  public EventLevel getLevel() {
    return state.level();
  }

  /** Whether deletion was requested while the registry lock was held and is still pending. */
  public boolean isDeleteDeferred() {
    return deleteDeferred;
  }

  /** Whether the registry-side record has been destroyed. */
  public boolean isDestroyed() {
    return destroyed;
  }

  /**
   * Declares an event emitted by this provider.
   *
   * @param eventId numeric event id (treated as unsigned 32-bit on the wire)
   * @param keywords keywords the event belongs to (0 = always matches)
   * @param eventVersion event schema version
   * @param level verbosity of the event
   * @param needStack whether a stack should be captured with each instance
   * @param metadata schema description blob (may be empty)
   * @return the event descriptor
   */
  public TraceEvent addEvent(
      int eventId,
      long keywords,
      int eventVersion,
      EventLevel level,
      boolean needStack,
      byte[] metadata) {
    TraceEvent event =
        new TraceEvent(this, eventId, keywords, eventVersion, level, needStack, metadata);
    events.add(event);
    return event;
  }

  /** Events declared so far (unmodifiable snapshot). */
  public List<TraceEvent> getEvents() {
    return List.copyOf(events);
  }

  /**
   * Checks whether an event with the given keywords and level would currently be recorded.
   *
   * <p>An event with no keywords matches any mask. {@link EventLevel#LOG_ALWAYS} events pass any
   * level.
   */
  public boolean isEventEnabled(long eventKeywords, EventLevel eventLevel) {
    FilterState current = state;
    if (!current.enabled() || destroyed) {
      return false;
    }
    boolean keywordsMatch = eventKeywords == 0 || (current.keywords() & eventKeywords) != 0;
    return keywordsMatch && current.level().permits(eventLevel);
  }

  /**
   * Replaces the filter state and notifies the provider callback.
   *
   * <p>Callback exceptions propagate to the caller; {@link ProviderRegistry} catches them so one
   * faulty provider cannot abort a sweep.
   */
  void setConfiguration(boolean enabled, long keywords, EventLevel level) {
    state = new FilterState(enabled, keywords, Objects.requireNonNull(level, "level"));
    if (callback != null) {
      callback.onConfigurationChanged(name, enabled, keywords, level, callbackData);
    }
  }

  void markDeleteDeferred() {
    deleteDeferred = true;
  }

  void destroy() {
    destroyed = true;
    deleteDeferred = false;
    state = FilterState.DISABLED;
    events.clear();
  }

  @Override
  public String toString() {
    FilterState current = state;
    return "TraceProvider{name="
        + name
        + ", enabled="
        + current.enabled()
        + ", keywords=0x"
        + Long.toHexString(current.keywords())
        + ", level="
        + current.level()
        + (deleteDeferred ? ", deleteDeferred" : "")
        + "}";
  }

  private record FilterState(boolean enabled, long keywords, EventLevel level) {
    static final FilterState DISABLED = new FilterState(false, 0, EventLevel.CRITICAL);
  }
}
