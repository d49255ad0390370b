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
 * Notified whenever a provider's filter configuration changes.
 *
 * <p>Callbacks run on the thread performing the change, usually while the registry lock is held
 * by a session sweep. A callback that wants to delete its own provider must go through {@link
 * TracePipe#deleteProvider}, which defers the deletion until the sweep is over.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProviderCallback {

  /**
   * Called after the provider's configuration was updated.
   *
   * @param providerName name of the reconfigured provider
   * @param enabled whether the provider is now enabled
   * @param keywords active keyword mask
   * @param level active verbosity level
   * @param callbackData opaque data supplied when the provider was created (may be null)
   */
  void onConfigurationChanged(
      String providerName, boolean enabled, long keywords, EventLevel level, Object callbackData);
}
