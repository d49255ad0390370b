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

package com.axonops.tracepipe.util;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single lock guarding the provider list and the session filter list.
 *
 * <p>Acquisition is deliberately not re-entrant: a thread that already holds the lock and tries
 * to take it again gets an {@link IllegalStateException}. Code that may run under the lock
 * (provider callbacks, session sweeps) uses the {@code NoLock} variants or defers its work.
 *
 * <pre>{@code
 * try (PipeLock.Held held = lock.acquire()) {
 *   registry.lookupNoLock("MyProvider");
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class PipeLock {

  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Blocks until the lock is acquired.
   *
   * @return guard releasing the lock on close
   * @throws IllegalStateException if the current thread already holds the lock
   */
  public Held acquire() {
    checkNotHeld();
    lock.lock();
    return new Held();
  }

  /**
   * Attempts to acquire the lock within the timeout.
   *
   * @param timeout maximum wait
   * @param unit unit of timeout
   * @return guard if acquired, empty if the timeout elapsed
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the current thread already holds the lock
   */
  public Optional<Held> tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
    checkNotHeld();
    if (lock.tryLock(timeout, unit)) {
      return Optional.of(new Held());
    }
    return Optional.empty();
  }

  /** Whether the calling thread owns the lock. */
  public boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  /** Whether any thread owns the lock. */
  public boolean isLocked() {
    return lock.isLocked();
  }

  /**
   * Precondition check for operations that must run under the lock.
   *
   * @param operation name used in the error message
   * @throws IllegalStateException if the calling thread does not hold the lock
   */
  public void assertHeld(String operation) {
    if (!lock.isHeldByCurrentThread()) {
      throw new IllegalStateException(
          "TracePipe: " + operation + " requires the registry lock to be held by the caller");
    }
  }

  private void checkNotHeld() {
    if (lock.isHeldByCurrentThread()) {
      throw new IllegalStateException(
          "TracePipe: registry lock is already held by thread "
              + Thread.currentThread().getName()
              + " and must not be acquired again");
    }
  }

  /** Lock ownership, released exactly once by {@link #close()}. */
  public final class Held implements AutoCloseable {
    private boolean released;

    private Held() {}

    @Override
    public void close() {
      if (!released) {
        released = true;
        lock.unlock();
      }
    }
  }
}
