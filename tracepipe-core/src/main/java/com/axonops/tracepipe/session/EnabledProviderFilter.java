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

package com.axonops.tracepipe.session;

import com.axonops.tracepipe.api.EventLevel;
import com.axonops.tracepipe.api.ProviderConfiguration;
import java.util.Objects;

/**
 * One enable rule of a session: which provider, which keywords, which level.
 *
 * @param providerName provider the rule applies to, or null for the catch-all rule
 * @param keywords keyword mask to activate
 * @param level verbosity to activate
 * @since 1.0.0
 */
public record EnabledProviderFilter(String providerName, long keywords, EventLevel level) {

  /** Keyword mask with every bit set. */
  public static final long ALL_KEYWORDS = 0xFFFFFFFFFFFFFFFFL;

  public EnabledProviderFilter {
    Objects.requireNonNull(level, "level cannot be null");
  }

  /**
   * Builds a rule from a session configuration entry.
   *
   * @throws IllegalArgumentException if the level value is outside 0..5
   */
  public static EnabledProviderFilter from(ProviderConfiguration configuration) {
    return new EnabledProviderFilter(
        configuration.providerName(),
        configuration.keywords(),
        EventLevel.fromValue(configuration.level()));
  }

  /** The rule returned for every provider in catch-all mode. */
  public static EnabledProviderFilter catchAll() {
    return new EnabledProviderFilter(null, ALL_KEYWORDS, EventLevel.VERBOSE);
  }

  public boolean isCatchAll() {
    return providerName == null;
  }
}
