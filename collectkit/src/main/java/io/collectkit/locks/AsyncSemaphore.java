/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.locks;

import java.util.concurrent.CompletionStage;

/**
 * An asynchronously acquirable counting semaphore
 * <p>
 * Implementations will specify whether their permit acquisition and release is fair or not; this
 * interface does not define this requirement.
 */
public interface AsyncSemaphore {

  /**
   * Acquires the given number of permits from the semaphore, returning a stage which will complete
   * when all of the permits are exclusively acquired. The stage may already be complete if the
   * permits are available immediately.
   *
   * @param permits the number of permits to acquire. Must be non-negative
   * @return a stage which will complete when all permits have been successfully acquired
   * @throws IllegalArgumentException if the requested permits are negative, or exceed any
   *         restrictions enforced by the given implementation
   */
  CompletionStage<Void> acquire(long permits);

  /**
   * Releases the given number of permits to the semaphore. If there are unfulfilled acquires
   * pending, this method will release permits to the waiting acquisitions.
   *
   * @param permits the number of permits to release. Must be non-negative
   * @throws IllegalArgumentException if the released permits are negative, or exceed any
   *         restrictions enforced by the given implementation
   */
  void release(long permits);

  /**
   * Attempts to acquire the given number of permits from the semaphore, returning a boolean
   * indicating whether all of the permits were immediately available and have been exclusively
   * acquired.
   *
   * @param permits the number of permits to acquire. Must be non-negative
   * @return true iff all of the requested permits are available, and have been immediately acquired
   * @throws IllegalArgumentException if the requested permits are negative, or exceed any
   *         restrictions enforced by the given implementation
   */
  boolean tryAcquire(long permits);

  /**
   * Acquires all permits that are immediately available.
   *
   * @return the number of permits that were available and subsequently acquired
   */
  long drainPermits();

  /**
   * Gets the number of currently available permits. This value is only a snapshot and may change
   * at any time.
   */
  long getAvailablePermits();

  /**
   * Gets the number of unfulfilled acquisitions waiting on this semaphore's permits. This value is
   * only a snapshot and may change at any time.
   */
  int getQueueLength();

  /**
   * Acquires 1 permit from the semaphore as if by calling {@link #acquire(long)} with an argument
   * of 1.
   */
  default CompletionStage<Void> acquire() {
    return acquire(1L);
  }

  /**
   * Releases 1 permit to the semaphore as if by calling {@link #release(long)} with an argument of
   * 1.
   */
  default void release() {
    release(1L);
  }

  /**
   * Attempts to acquire 1 permit from the semaphore as if by calling {@link #tryAcquire(long)}
   * with an argument of 1.
   */
  default boolean tryAcquire() {
    return tryAcquire(1L);
  }
}
