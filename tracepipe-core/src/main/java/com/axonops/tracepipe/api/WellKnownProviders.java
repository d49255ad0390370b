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
 * Provider names and masks recognised by trace consumers.
 *
 * <p>These strings end up in trace files and are matched by external decoders, so they are fixed.
 *
 * @since 1.0.0
 */
public final class WellKnownProviders {

  /** Internal provider that owns the metadata event. Registered for the lifetime of the pipe. */
  public static final String CONFIGURATION_PROVIDER_NAME =
      "Microsoft-DotNETCore-EventPipeConfiguration";

  /** Public runtime provider enabled during rundown. */
  public static final String RUNTIME_PROVIDER_NAME = "Microsoft-Windows-DotNETRuntime";

  /** Dedicated rundown provider enabled during rundown. */
  public static final String RUNDOWN_PROVIDER_NAME = "Microsoft-Windows-DotNETRuntimeRundown";

  /** Keyword mask enabled on both rundown providers. */
  public static final long RUNDOWN_KEYWORDS = 0x80020138L;

  /** Event id of the metadata event on the configuration provider. */
  public static final int METADATA_EVENT_ID = 0;

  private WellKnownProviders() {
    // Constants
  }
}
