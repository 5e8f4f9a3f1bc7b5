/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.flow;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

import io.collectkit.collection.Collected;

/**
 * Moves {@link Collected} collections across a {@link Flow} boundary. A push source is drained into
 * a realized collection before it enters a pipeline, and a realized collection can be published to
 * any number of subscribers.
 *
 * <pre>
 * {@code
 * CompletionStage<List<Integer>> evens = FlowAdapter.drain(publisher)
 *     .thenCompose(items -> items.lazy().filter(x -> x % 2 == 0).toList());
 * }
 * </pre>
 */
public class FlowAdapter {

  private FlowAdapter() {}

  /**
   * Publishes the items of {@code collected}, in order, to every subscriber. Each subscription
   * starts from the first item and honors the subscriber's demand; the publisher completes an empty
   * collection without waiting for a request.
   *
   * @param collected the items to publish; a {@code null} item is reported to the subscriber as a
   *        {@link NullPointerException} in place of the item, since {@link Flow} forbids them
   * @return a {@link Flow.Publisher} that supports multiple subscriptions
   */
  public static <T> Flow.Publisher<T> publish(final Collected<T> collected) {
    return new CollectedPublisher<>(collected);
  }

  /**
   * Subscribes to {@code publisher} and gathers every item it produces, without bounding demand.
   *
   * @return a stage of the published items in order, completed exceptionally with the publisher's
   *         error if it reports one
   * @see #drain(Flow.Publisher, long)
   */
  public static <T> CompletionStage<Collected<T>> drain(
      final Flow.Publisher<? extends T> publisher) {
    return drain(publisher, Long.MAX_VALUE);
  }

  /**
   * Subscribes to {@code publisher} and gathers every item it produces, requesting
   * {@code batchSize} items at a time. A new batch is requested once the previous one has arrived
   * in full.
   *
   * @param publisher the push source to drain
   * @param batchSize how many items to request at once
   * @return a stage of the published items in order, completed exceptionally with the publisher's
   *         error if it reports one
   * @throws IllegalArgumentException if {@code batchSize} is not positive
   */
  public static <T> CompletionStage<Collected<T>> drain(
      final Flow.Publisher<? extends T> publisher, final long batchSize) {
    Objects.requireNonNull(publisher);
    final CollectingSubscriber<T> subscriber = new CollectingSubscriber<>(batchSize);
    publisher.subscribe(subscriber);
    return subscriber.result();
  }
}
