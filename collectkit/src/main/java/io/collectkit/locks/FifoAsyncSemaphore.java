/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.locks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import io.collectkit.util.StageSupport;

/**
 * An {@link AsyncSemaphore} with a strict first-in-first-out waiting policy: if the permits
 * requested by an {@link #acquire(long)} cannot be granted immediately, every later acquisition
 * waits behind it, even one that asks for fewer permits than are available. This mirrors a
 * synchronous {@link java.util.concurrent.Semaphore Semaphore} with fairness enabled.
 * <p>
 * State is guarded by this object's monitor, so acquisitions and releases may come from any
 * thread. Waiting acquisitions are completed outside the monitor.
 */
public class FifoAsyncSemaphore implements AsyncSemaphore {

  /*
   * Releasing a permit may complete a waiter whose dependents synchronously release the same
   * semaphore again, which would recurse once per waiter. As in a trampoline, the first release on
   * a thread becomes the "thread leader": it collects fulfilled futures into a thread local list,
   * and completes them in insertion order after its own traversal. Nested releases on that thread
   * only append to the list and return.
   */
  private static final ThreadLocal<ArrayList<CompletableFuture<Void>>> TRAMPOLINE_FUTURES =
      ThreadLocal.withInitial(ArrayList::new);

  /**
   * The greatest number of permits with which this semaphore can be initialized, and that can be
   * acquired or released with a single operation.
   */
  public static final long MAX_PERMITS = Long.MAX_VALUE / 2;

  private static final class Waiter {
    final long permits;
    final CompletableFuture<Void> future = new CompletableFuture<>();

    Waiter(final long permits) {
      this.permits = permits;
    }
  }

  private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
  private long permits;

  /**
   * Creates a new semaphore with the given initial number of permits.
   *
   * @param initialPermits the initial number of permits, within [0, {@link #MAX_PERMITS}]
   */
  public FifoAsyncSemaphore(final long initialPermits) {
    checkPermitsBounds(initialPermits);
    this.permits = initialPermits;
  }

  private static void checkPermitsBounds(final long permits) {
    if (permits < 0L || permits > MAX_PERMITS) {
      throw new IllegalArgumentException(
          String.format("permits must be within [%d, %d], given %d", 0L, MAX_PERMITS, permits));
    }
  }

  /**
   * Acquires the given number of permits, queueing behind earlier unfulfilled acquisitions.
   * Acquiring {@code 0} permits completes immediately when nobody is waiting, otherwise it
   * completes together with the last waiter queued at the time of the call.
   */
  @Override
  public CompletionStage<Void> acquire(final long permits) {
    checkPermitsBounds(permits);
    synchronized (this) {
      if (this.waiters.isEmpty() && this.permits >= permits) {
        this.permits -= permits;
        return StageSupport.voidStage();
      }
      if (permits == 0L) {
        return this.waiters.peekLast().future;
      }
      final Waiter waiter = new Waiter(permits);
      this.waiters.addLast(waiter);
      return waiter.future;
    }
  }

  @Override
  public void release(final long permits) {
    checkPermitsBounds(permits);
    final List<CompletableFuture<Void>> fulfilled = new ArrayList<>();
    synchronized (this) {
      if (MAX_PERMITS - permits < this.permits) {
        throw new IllegalStateException(
            String.format("Exceeded maximum allowed semaphore permits: %d + %d > %d",
                this.permits, permits, MAX_PERMITS));
      }
      this.permits += permits;
      Waiter head;
      while ((head = this.waiters.peekFirst()) != null && head.permits <= this.permits) {
        this.permits -= head.permits;
        this.waiters.pollFirst();
        fulfilled.add(head.future);
      }
    }
    if (fulfilled.isEmpty()) {
      return;
    }

    final ArrayList<CompletableFuture<Void>> toComplete = TRAMPOLINE_FUTURES.get();
    final boolean threadLeader = toComplete.isEmpty();
    toComplete.addAll(fulfilled);
    if (threadLeader) {
      // list may grow while iterating through nested releases; an index loop picks those up
      for (int i = 0; i < toComplete.size(); i++) {
        toComplete.get(i).complete(null);
      }
      toComplete.clear();
    }
  }

  @Override
  public synchronized boolean tryAcquire(final long permits) {
    checkPermitsBounds(permits);
    if (this.waiters.isEmpty() && this.permits >= permits) {
      this.permits -= permits;
      return true;
    }
    return false;
  }

  @Override
  public synchronized long drainPermits() {
    final long drained = this.permits;
    this.permits = 0L;
    return drained;
  }

  @Override
  public synchronized long getAvailablePermits() {
    return this.permits;
  }

  @Override
  public synchronized int getQueueLength() {
    return this.waiters.size();
  }

  @Override
  public String toString() {
    return "FifoAsyncSemaphore [permits=" + getAvailablePermits() + ", waiters="
        + getQueueLength() + "]";
  }
}
