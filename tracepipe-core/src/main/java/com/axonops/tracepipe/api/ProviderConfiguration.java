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

import java.util.Objects;

/**
 * One entry of a session enable request, as supplied by the session manager.
 *
 * <p>The level is kept as its raw protocol value; it is validated when the session filter list
 * is built.
 *
 * @param providerName provider to enable (exact, case-sensitive)
 * @param keywords keyword mask to activate
 * @param level level value, 0 (LogAlways) to 5 (Verbose)
 * @since 1.0.0
 */
public record ProviderConfiguration(String providerName, long keywords, int level) {

  public ProviderConfiguration {
    Objects.requireNonNull(providerName, "providerName cannot be null");
  }

  /** Convenience constructor taking a typed level. */
  public ProviderConfiguration(String providerName, long keywords, EventLevel level) {
    this(providerName, keywords, level.value());
  }
}
