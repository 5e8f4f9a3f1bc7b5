/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.flow;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.collectkit.collection.Collected;

/**
 * Publishes the items of a {@link Collected} in order. Every subscriber gets its own subscription
 * over the same items, starting from the first.
 */
final class CollectedPublisher<T> implements Flow.Publisher<T> {
  private static final Logger LOGGER = LogManager.getLogger(CollectedPublisher.class);

  private final Collected<T> collected;

  CollectedPublisher(final Collected<T> collected) {
    this.collected = Objects.requireNonNull(collected);
  }

  @Override
  public void subscribe(final Flow.Subscriber<? super T> subscriber) {
    Objects.requireNonNull(subscriber);
    final ItemSubscription<T> subscription =
        new ItemSubscription<>(this.collected.items(), subscriber);
    subscriber.onSubscribe(subscription);
    // completes an empty collection without waiting for demand
    subscription.emit();
  }

  @Override
  public String toString() {
    return "CollectedPublisher[size=" + this.collected.size() + "]";
  }

  /**
   * Delivers items as demand allows. Only one thread runs the emit loop at a time; signals that
   * arrive while it runs (requests, cancellation, requests from inside {@code onNext}) are picked
   * up by that thread before it leaves, so recursion stays bounded.
   */
  private static final class ItemSubscription<T> implements Flow.Subscription {
    private final List<T> items;
    private final AtomicLong requested = new AtomicLong();
    private final AtomicInteger pending = new AtomicInteger();
    private volatile boolean cancelled;
    private volatile IllegalArgumentException invalidRequest;

    // only touched by the thread running the emit loop; cleared once terminated
    private Flow.Subscriber<? super T> subscriber;
    private int index;

    ItemSubscription(final List<T> items, final Flow.Subscriber<? super T> subscriber) {
      this.items = items;
      this.subscriber = subscriber;
    }

    @Override
    public void request(final long n) {
      if (n <= 0) {
        this.invalidRequest = new IllegalArgumentException(
            "non-positive subscription request (rule 3.9): " + n);
      } else {
        this.requested.getAndUpdate(r -> r + n < 0 ? Long.MAX_VALUE : r + n);
      }
      emit();
    }

    @Override
    public void cancel() {
      this.cancelled = true;
      emit();
    }

    void emit() {
      if (this.pending.getAndIncrement() != 0) {
        return;
      }
      int missed = 1;
      while (true) {
        if (emitAvailable()) {
          // pending is never brought back to zero, so later signals are no-ops
          this.subscriber = null;
          return;
        }
        missed = this.pending.addAndGet(-missed);
        if (missed == 0) {
          return;
        }
      }
    }

    /**
     * @return true if the subscription is finished, by cancellation or by a terminal signal
     */
    private boolean emitAvailable() {
      final Flow.Subscriber<? super T> s = this.subscriber;
      final long demand = this.requested.get();
      long sent = 0;
      while (true) {
        if (this.cancelled) {
          LOGGER.trace("Subscription cancelled at item {} of {}", this.index, this.items.size());
          return true;
        }
        final IllegalArgumentException invalid = this.invalidRequest;
        if (invalid != null) {
          this.cancelled = true;
          s.onError(invalid);
          return true;
        }
        if (this.index == this.items.size()) {
          s.onComplete();
          return true;
        }
        if (sent == demand) {
          break;
        }
        final T item = this.items.get(this.index++);
        if (item == null) {
          this.cancelled = true;
          s.onError(new NullPointerException(
              "Flow subscribers cannot receive null items, found one at " + (this.index - 1)));
          return true;
        }
        s.onNext(item);
        sent++;
      }
      if (demand != Long.MAX_VALUE) {
        this.requested.addAndGet(-sent);
      }
      return false;
    }
  }
}
