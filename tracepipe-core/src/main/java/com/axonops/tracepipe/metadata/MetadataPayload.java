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

package com.axonops.tracepipe.metadata;

import java.util.Arrays;
import java.util.Objects;

/**
 * Decoded content of a metadata event payload.
 *
 * <p>{@code eventId}, {@code eventVersion} are unsigned 32-bit values on the wire; use {@link
 * Integer#toUnsignedLong(int)} when they may exceed {@link Integer#MAX_VALUE}.
 *
 * @param providerName name of the provider that owns the described event
 * @param eventId described event id
 * @param eventVersion described event version
 * @param schema schema description blob
 * @since 1.0.0
 */
public record MetadataPayload(String providerName, int eventId, int eventVersion, byte[] schema) {

  public MetadataPayload {
    Objects.requireNonNull(providerName, "providerName cannot be null");
    schema = schema == null ? new byte[0] : schema.clone();
  }

  @Override
  public byte[] schema() {
    return schema.clone();
  }

  public int schemaLength() {
    return schema.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetadataPayload other)) {
      return false;
    }
    return eventId == other.eventId
        && eventVersion == other.eventVersion
        && providerName.equals(other.providerName)
        && Arrays.equals(schema, other.schema);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(providerName, eventId, eventVersion);
    return 31 * result + Arrays.hashCode(schema);
  }

  @Override
  public String toString() {
    return "MetadataPayload{provider="
        + providerName
        + ", eventId="
        + Integer.toUnsignedString(eventId)
        + ", eventVersion="
        + Integer.toUnsignedString(eventVersion)
        + ", schemaLength="
        + schema.length
        + "}";
  }
}
