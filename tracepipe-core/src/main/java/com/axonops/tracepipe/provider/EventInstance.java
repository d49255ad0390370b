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

import java.util.Objects;

/**
 * One emitted occurrence of a {@link TraceEvent}.
 *
 * <p>The payload is the already-encoded event body. The timestamp defaults to {@link
 * System#nanoTime()} at construction and may be overwritten, which is how a metadata event is
 * aligned with the event it describes.
 *
 * @since 1.0.0
 */
public final class EventInstance {

  private final TraceEvent event;
  private final long threadId;
  private final byte[] payload;
  private long timestamp;

  public EventInstance(TraceEvent event, long threadId, byte[] payload) {
    this(event, threadId, payload, System.nanoTime());
  }

  public EventInstance(TraceEvent event, long threadId, byte[] payload, long timestamp) {
    this.event = Objects.requireNonNull(event, "event cannot be null");
    this.threadId = threadId;
    this.payload = payload == null ? new byte[0] : payload.clone();
    this.timestamp = timestamp;
  }

  public TraceEvent getEvent() {
    return event;
  }

  public long getThreadId() {
    return threadId;
  }

  /** Payload bytes (copy). */
  public byte[] getPayload() {
    return payload.clone();
  }

  public int getPayloadLength() {
    return payload.length;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public void setTimestamp(long timestamp) {
    this.timestamp = timestamp;
  }
}
