/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.parallel;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * The set of task handles a scheduler run has admitted and that have not settled yet. Never holds
 * more than its capacity; an admission beyond it is a scheduling bug and fails with
 * {@link IllegalStateException}. Thread safe.
 */
public class ConcurrencyLedger {
  private final int capacity;
  private final Set<CompletableFuture<?>> outstanding = new LinkedHashSet<>();
  private int highWaterMark;

  public ConcurrencyLedger(final int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, given " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Adds an outstanding handle.
   *
   * @throws IllegalStateException if the ledger is already at capacity
   */
  public synchronized void register(final CompletableFuture<?> handle) {
    if (this.outstanding.size() >= this.capacity) {
      throw new IllegalStateException(
          "ledger already holds " + this.outstanding.size() + " of " + this.capacity + " handles");
    }
    this.outstanding.add(handle);
    this.highWaterMark = Math.max(this.highWaterMark, this.outstanding.size());
  }

  /** @return whether {@code handle} was outstanding */
  public synchronized boolean remove(final CompletableFuture<?> handle) {
    return this.outstanding.remove(handle);
  }

  public synchronized int size() {
    return this.outstanding.size();
  }

  public int getCapacity() {
    return this.capacity;
  }

  /** @return the greatest number of handles that were outstanding at once */
  public synchronized int getHighWaterMark() {
    return this.highWaterMark;
  }

  /** @return a copy of the outstanding handles, in admission order */
  public synchronized List<CompletableFuture<?>> snapshot() {
    return new ArrayList<>(this.outstanding);
  }

  @Override
  public synchronized String toString() {
    return "ConcurrencyLedger [outstanding=" + this.outstanding.size() + ", capacity="
        + this.capacity + ", highWaterMark=" + this.highWaterMark + "]";
  }
}
