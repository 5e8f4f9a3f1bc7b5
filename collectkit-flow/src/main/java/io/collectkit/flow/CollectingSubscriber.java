/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.collectkit.collection.Collected;

/**
 * Gathers everything a publisher produces into a {@link Collected}, requesting {@code batchSize}
 * items at a time. Signals are serial per the {@link Flow} contract, so the buffer needs no
 * locking.
 */
class CollectingSubscriber<T> implements Flow.Subscriber<T> {
  private static final Logger LOGGER = LogManager.getLogger(CollectingSubscriber.class);

  private final long batchSize;
  private final List<T> items = new ArrayList<>();
  private final CompletableFuture<Collected<T>> result = new CompletableFuture<>();
  private Flow.Subscription subscription;
  private long outstanding;

  CollectingSubscriber(final long batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batch size must be positive: " + batchSize);
    }
    this.batchSize = batchSize;
  }

  CompletionStage<Collected<T>> result() {
    return this.result;
  }

  @Override
  public void onSubscribe(final Flow.Subscription subscription) {
    Objects.requireNonNull(subscription);
    if (this.subscription != null) {
      LOGGER.debug("Cancelling a second subscription {}", subscription);
      subscription.cancel();
      return;
    }
    this.subscription = subscription;
    this.outstanding = this.batchSize;
    subscription.request(this.batchSize);
  }

  @Override
  public void onNext(final T item) {
    Objects.requireNonNull(item);
    this.items.add(item);
    if (this.batchSize != Long.MAX_VALUE && --this.outstanding == 0) {
      this.outstanding = this.batchSize;
      this.subscription.request(this.batchSize);
    }
  }

  @Override
  public void onError(final Throwable throwable) {
    Objects.requireNonNull(throwable);
    LOGGER.debug("Publisher failed after {} items", this.items.size(), throwable);
    this.result.completeExceptionally(throwable);
  }

  @Override
  public void onComplete() {
    LOGGER.trace("Publisher completed with {} items", this.items.size());
    this.result.complete(Collected.collect(this.items));
  }

  @Override
  public String toString() {
    return "CollectingSubscriber[batchSize=" + this.batchSize + ", received=" + this.items.size()
        + "]";
  }
}
