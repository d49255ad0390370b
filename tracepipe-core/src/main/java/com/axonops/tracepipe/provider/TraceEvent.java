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
import java.util.Objects;

/**
 * Immutable description of one event type declared by a {@link TraceProvider}.
 *
 * @since 1.0.0
 */
public final class TraceEvent {

  private final TraceProvider provider;
  private final int eventId;
  private final long keywords;
  private final int eventVersion;
  private final EventLevel level;
  private final boolean needStack;
  private final byte[] metadata;

  TraceEvent(
      TraceProvider provider,
      int eventId,
      long keywords,
      int eventVersion,
      EventLevel level,
      boolean needStack,
      byte[] metadata) {
    this.provider = Objects.requireNonNull(provider, "provider cannot be null");
    this.eventId = eventId;
    this.keywords = keywords;
    this.eventVersion = eventVersion;
    this.level = Objects.requireNonNull(level, "level cannot be null");
    this.needStack = needStack;
    this.metadata = metadata == null ? new byte[0] : metadata.clone();
  }

  public TraceProvider getProvider() {
    return provider;
  }

  public int getEventId() {
    return eventId;
  }

  public long getKeywords() {
    return keywords;
  }

  public int getEventVersion() {
    return eventVersion;
  }

  public EventLevel getLevel() {
    return level;
  }

  public boolean needStack() {
    return needStack;
  }

  /** Schema description blob (defensive copy). */
  public byte[] getMetadata() {
    return metadata.clone();
  }

  public int getMetadataLength() {
    return metadata.length;
  }

  /** Whether instances of this event would be recorded under the provider's current filter. */
  public boolean isEnabled() {
    return provider.isEventEnabled(keywords, level);
  }

  @Override
  public String toString() {
    return provider.getName() + "/" + Integer.toUnsignedString(eventId) + "v" + eventVersion;
  }
}
