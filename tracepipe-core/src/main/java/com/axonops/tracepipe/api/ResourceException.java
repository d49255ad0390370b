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
 * Thrown (or reported through a {@link TeardownResult}) when registry resources cannot be
 * released, typically because the registry lock could not be acquired during teardown.
 *
 * @since 1.0.0
 */
public final class ResourceException extends TracePipeException {

  public ResourceException(String message) {
    super("TracePipe: Resource error: " + message);
  }

  public ResourceException(String message, Throwable cause) {
    super("TracePipe: Resource error: " + message, cause);
  }
}
