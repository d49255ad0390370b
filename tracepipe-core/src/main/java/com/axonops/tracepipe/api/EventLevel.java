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

/**
 * Event verbosity level.
 *
 * <p>Ordered from most restrictive to most verbose. The ordinal values are part of the session
 * configuration protocol and must not be reordered.
 *
 * @since 1.0.0
 */
public enum EventLevel {
  LOG_ALWAYS(0),
  CRITICAL(1),
  ERROR(2),
  WARNING(3),
  INFORMATIONAL(4),
  VERBOSE(5);

  private final int value;

  EventLevel(int value) {
    this.value = value;
  }

  /**
   * Gets the numeric value used in session configuration.
   *
   * @return level value between 0 and 5
   */
  public int value() {
    return value;
  }

  /**
   * Resolves a level from its numeric value.
   *
   * @param value level value (0 = LogAlways ... 5 = Verbose)
   * @return the matching level
   * @throws IllegalArgumentException if value is outside 0..5
   */
  public static EventLevel fromValue(int value) {
    for (EventLevel level : values()) {
      if (level.value == value) {
        return level;
      }
    }
    throw new IllegalArgumentException("Unknown event level: " + value + " (expected 0..5)");
  }

  /**
   * Checks whether an event at {@code eventLevel} passes a provider configured at this level.
   *
   * <p>{@link #LOG_ALWAYS} events always pass.
   */
  public boolean permits(EventLevel eventLevel) {
    return eventLevel == LOG_ALWAYS || value >= eventLevel.value;
  }
}
