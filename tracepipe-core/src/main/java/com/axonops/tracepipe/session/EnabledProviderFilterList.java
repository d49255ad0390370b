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

import com.axonops.tracepipe.api.ProviderConfiguration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Enable rules of one session.
 *
 * <p>Either a single catch-all rule that matches every provider with all keywords at Verbose, or
 * a list of named rules searched linearly. Provider populations are small (tens), so a scan beats
 * hashing on the session start path.
 *
 * @since 1.0.0
 */
public final class EnabledProviderFilterList {

  private final EnabledProviderFilter catchAllFilter;
  private final List<EnabledProviderFilter> filters;

  private EnabledProviderFilterList(
      EnabledProviderFilter catchAllFilter, List<EnabledProviderFilter> filters) {
    this.catchAllFilter = catchAllFilter;
    this.filters = filters;
  }

  /**
   * Builds the filter list for a session.
   *
   * @param configurations provider rules from the session manager (may be empty)
   * @param catchAll start-up catch-all flag; when set, {@code configurations} is ignored
   * @return the filter list
   * @throws IllegalArgumentException if a rule has an unknown level value
   */
  public static EnabledProviderFilterList of(
      Collection<ProviderConfiguration> configurations, boolean catchAll) {
    if (catchAll) {
      return new EnabledProviderFilterList(EnabledProviderFilter.catchAll(), List.of());
    }

    Objects.requireNonNull(configurations, "configurations cannot be null");
    List<EnabledProviderFilter> built = new ArrayList<>(configurations.size());
    for (ProviderConfiguration configuration : configurations) {
      built.add(EnabledProviderFilter.from(configuration));
    }
    return new EnabledProviderFilterList(null, Collections.unmodifiableList(built));
  }

  /**
   * Finds the rule for a provider.
   *
   * @param providerName exact provider name (ordinal, case-sensitive comparison)
   * @return the first matching rule, the catch-all rule, or empty
   */
  public Optional<EnabledProviderFilter> matchProvider(String providerName) {
    if (catchAllFilter != null) {
      return Optional.of(catchAllFilter);
    }

    for (EnabledProviderFilter filter : filters) {
      if (filter.providerName().equals(providerName)) {
        return Optional.of(filter);
      }
    }
    return Optional.empty();
  }

  public boolean isCatchAll() {
    return catchAllFilter != null;
  }

  /** Named rules in the order supplied; empty in catch-all mode. */
  public List<EnabledProviderFilter> filters() {
    return filters;
  }

  /** Number of named rules (0 in catch-all mode). */
  public int size() {
    return filters.size();
  }

  @Override
  public String toString() {
    return isCatchAll()
        ? "EnabledProviderFilterList{catchAll}"
        : "EnabledProviderFilterList" + filters;
  }
}
