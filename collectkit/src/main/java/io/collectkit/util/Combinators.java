/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.stream.Collector;
import java.util.stream.Collectors;

/**
 * Utility methods for combining more than one {@link CompletionStage} into a single
 * {@link CompletionStage}
 */
public class Combinators {
  private Combinators() {}

  /*
   * The maximum allowed size of a chain of dependants on a stage. allOf and collect set up a single
   * linear dependency chain; if a CompletionStage implementation does not trampoline the
   * notification of dependent stages, a longer chain can overflow the stack on notification
   */
  private static final int MAX_DEPENDANT_DEPTH = 256;

  /**
   * Given a collection of stages, returns a new {@link CompletionStage} that is completed when all
   * input stages are complete. If any stage completes exceptionally, the returned stage will
   * complete exceptionally.
   *
   * @param stages a Collection of {@link CompletionStage}
   * @return a {@link CompletionStage} which will complete after every stage in {@code stages}
   *         completes
   * @throws NullPointerException if {@code stages} or any of its elements are null
   */
  public static CompletionStage<Void> allOf(
      final Collection<? extends CompletionStage<?>> stages) {
    CompletionStage<Void> accumulator = StageSupport.voidStage();
    for (final CompletionStage<?> stage : safeChain(stages)) {
      accumulator = accumulator.thenCombine(stage, (l, r) -> null);
    }
    return accumulator;
  }

  /**
   * Given a collection of stages all of the same type, returns a new {@link CompletionStage} that
   * is completed with a list of the results of all input stages when all stages complete. The
   * iteration order of {@code stages} is preserved in the returned list, regardless of the order in
   * which the stages complete. If an element of {@code stages} completes exceptionally, so too will
   * the returned stage.
   *
   * @param stages a Collection of {@link CompletionStage} all of type T
   * @return a {@link CompletionStage} of the results of {@code stages}
   * @throws NullPointerException if {@code stages} or any of its elements are null
   */
  public static <T> CompletionStage<List<T>> collect(
      final Collection<? extends CompletionStage<T>> stages) {
    return collect(stages, Collectors.toCollection(() -> new ArrayList<>(stages.size())));
  }

  /**
   * Applies a collector to the results of all {@code stages} after all complete. The collector is
   * applied in a single thread, in the iteration order of {@code stages}.
   *
   * @param stages a Collection of stages all of type T
   * @param collector a {@link Collector} applied to the results of {@code stages}
   * @return a {@link CompletionStage} of the collected result
   * @throws NullPointerException if {@code stages} or any of its elements are null
   */
  @SuppressWarnings("unchecked")
  public static <T, A, R> CompletionStage<R> collect(
      final Collection<? extends CompletionStage<T>> stages,
      final Collector<? super T, A, R> collector) {
    CompletionStage<A> acc = StageSupport.completedStage(collector.supplier().get());
    final BiConsumer<A, ? super T> accFun = collector.accumulator();

    for (final CompletionStage<T> stage : safeChain(stages)) {
      // each combination step runs only after all previous steps have completed
      acc = acc.thenCombine(stage, (a, t) -> {
        accFun.accept(a, t);
        return a;
      });
    }
    return collector.characteristics().contains(Collector.Characteristics.IDENTITY_FINISH)
        ? (CompletionStage<R>) acc
        : acc.thenApply(collector.finisher());
  }

  /*
   * CompletableFuture trampolines the notification of a dependant chain, so long chains are
   * converted to CompletableFutures first
   */
  @SuppressWarnings("unchecked")
  private static <S extends CompletionStage<?>> Iterable<S> safeChain(
      final Collection<? extends S> stages) {
    if (stages.size() <= MAX_DEPENDANT_DEPTH) {
      return (Iterable<S>) stages;
    }
    return () -> new Iterator<S>() {
      private final Iterator<? extends S> backing = stages.iterator();

      @Override
      public boolean hasNext() {
        return this.backing.hasNext();
      }

      @Override
      public S next() {
        return (S) this.backing.next().toCompletableFuture();
      }
    };
  }
}
