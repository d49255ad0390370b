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

import java.util.Optional;

/**
 * Outcome of a teardown step.
 *
 * <p>Teardown never throws. When the registry lock cannot be acquired the structures are left in
 * place (a leak accepted at process exit) and the cause is reported here instead.
 *
 * @param clean true if everything was released
 * @param leakedProviders number of registry entries left behind
 * @param failure cause of an incomplete teardown, or null
 * @since 1.0.0
 */
public record TeardownResult(boolean clean, int leakedProviders, ResourceException failure) {

  public static TeardownResult released() {
    return new TeardownResult(true, 0, null);
  }

  public static TeardownResult leaked(int leakedProviders, ResourceException failure) {
    return new TeardownResult(false, leakedProviders, failure);
  }

  public Optional<ResourceException> failureCause() {
    return Optional.ofNullable(failure);
  }
}
