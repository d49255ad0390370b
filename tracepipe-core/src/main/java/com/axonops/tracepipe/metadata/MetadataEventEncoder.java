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

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Encodes the payload of a metadata event: the self-description of another event type.
 *
 * <h2>Layout</h2>
 *
 * <p>Little-endian, fixed-width integers:
 *
 * <pre>
 * [provider name   : UTF-16LE code units, NUL-terminated]
 * [eventID         : uint32]
 * [eventVersion    : uint32]
 * [schemaLength    : uint32]
 * [schema          : schemaLength bytes]
 * </pre>
 *
 * <p>Total length is {@code (codeUnits(name) + 1) * 2 + 12 + schemaLength}.
 *
 * @since 1.0.0
 */
public final class MetadataEventEncoder {

  private static final int UTF16_UNIT_BYTES = Character.BYTES;
  private static final int FIXED_FIELDS_BYTES = 3 * Integer.BYTES;

  private MetadataEventEncoder() {
    // Utility class
  }

  /**
   * Computes the encoded size.
   *
   * @param providerName provider name
   * @param schemaLength schema blob length
   * @return payload size in bytes
   */
  public static int encodedLength(String providerName, int schemaLength) {
    return (providerName.length() + 1) * UTF16_UNIT_BYTES + FIXED_FIELDS_BYTES + schemaLength;
  }

  /**
   * Encodes a metadata payload.
   *
   * @param providerName provider owning the described event
   * @param eventId event id (unsigned 32-bit)
   * @param eventVersion event version (unsigned 32-bit)
   * @param schema schema description blob, may be null for none
   * @return encoded payload
   */
  public static byte[] encode(String providerName, int eventId, int eventVersion, byte[] schema) {
    Objects.requireNonNull(providerName, "providerName cannot be null");
    byte[] blob = schema == null ? new byte[0] : schema;

    int expected = encodedLength(providerName, blob.length);

    ByteBuffer buffer = ByteBuffer.allocate(expected).order(ByteOrder.LITTLE_ENDIAN);
    // Raw code units, unpaired surrogates written as-is
    for (int i = 0; i < providerName.length(); i++) {
      buffer.putChar(providerName.charAt(i));
    }
    buffer.putChar('\0');
    buffer.putInt(eventId);
    buffer.putInt(eventVersion);
    buffer.putInt(blob.length);
    buffer.put(blob);

    if (buffer.position() != expected) {
      throw new IllegalStateException(
          "TracePipe: metadata payload size mismatch - wrote "
              + buffer.position()
              + " bytes, expected "
              + expected);
    }
    return buffer.array();
  }

  /**
   * Decodes a payload produced by {@link #encode}.
   *
   * @param payload encoded payload
   * @return decoded fields
   * @throws IllegalArgumentException if the payload is truncated or malformed
   */
  public static MetadataPayload decode(byte[] payload) {
    Objects.requireNonNull(payload, "payload cannot be null");
    ByteBuffer buffer = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
    try {
      StringBuilder name = new StringBuilder();
      char c;
      while ((c = buffer.getChar()) != '\0') {
        name.append(c);
      }
      int eventId = buffer.getInt();
      int eventVersion = buffer.getInt();
      int schemaLength = buffer.getInt();
      if (schemaLength < 0 || schemaLength != buffer.remaining()) {
        throw new IllegalArgumentException(
            "Metadata schema length "
                + Integer.toUnsignedString(schemaLength)
                + " does not match remaining "
                + buffer.remaining()
                + " bytes");
      }
      byte[] schema = new byte[schemaLength];
      buffer.get(schema);
      return new MetadataPayload(name.toString(), eventId, eventVersion, schema);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException(
          "Truncated metadata payload (" + payload.length + " bytes)", e);
    }
  }
}
