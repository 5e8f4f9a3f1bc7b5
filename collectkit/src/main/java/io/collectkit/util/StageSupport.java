/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Utility methods for creating and composing {@link CompletionStage CompletionStages}
 */
public class StageSupport {
  private StageSupport() {}

  private static final CompletableFuture<Void> VOID = CompletableFuture.completedFuture(null);

  /**
   * Gets an already completed {@link CompletionStage} of Void. Using this method rather than
   * {@code completedStage(null)} makes it explicit that the stage carries no value, and saves an
   * allocation for a very common case.
   *
   * @return An immediately completed {@link CompletionStage} of {@code Void}
   */
  public static CompletionStage<Void> voidStage() {
    return VOID;
  }

  /**
   * Creates a {@link CompletionStage} that completes when {@code stage} completes but ignores the
   * result.
   *
   * @param stage a non-void {@link CompletionStage}
   * @return a {@link CompletionStage} of type Void which completes when {@code stage} completes
   */
  public static <T> CompletionStage<Void> voided(final CompletionStage<T> stage) {
    return stage.thenApply(ig -> null);
  }

  /**
   * Creates a {@link CompletionStage} that is already completed with the given value. Non-async
   * dependents of the returned stage run immediately on the calling thread.
   *
   * @param t the value to be held by the returned stage
   * @return a {@link CompletionStage} that has already been completed with {@code t}
   * @see #exceptionalStage(Throwable)
   */
  public static <T> CompletionStage<T> completedStage(final T t) {
    return CompletableFuture.completedFuture(t);
  }

  /**
   * Creates a {@link CompletionStage} that is already completed exceptionally. This is the
   * exceptional analog of {@link #completedStage(Object)}.
   *
   * @param ex the exception that completes the returned stage
   * @return a {@link CompletionStage} that has already been completed exceptionally with {@code ex}
   */
  public static <T> CompletionStage<T> exceptionalStage(final Throwable ex) {
    final CompletableFuture<T> future = new CompletableFuture<>();
    future.completeExceptionally(ex);
    return future;
  }

  /**
   * Calls {@code supplier}, converting a synchronously thrown exception into an exceptional stage.
   * Use this wherever a user callback, or a {@code nextStage()} implementation, is invoked at the
   * start of a composed chain.
   *
   * @param supplier produces a stage, and may throw
   * @return the stage produced by {@code supplier}, or an exceptional stage holding what it threw
   */
  public static <T> CompletionStage<T> convertSynchronousException(
      final Supplier<? extends CompletionStage<T>> supplier) {
    try {
      return supplier.get();
    } catch (final Throwable e) {
      return exceptionalStage(e);
    }
  }

  /**
   * Strips the {@link CompletionException} wrapper that {@link CompletableFuture} adds to
   * exceptions of dependent stages.
   *
   * @param throwable an exception observed on a stage, may be {@code null}
   * @return the cause when {@code throwable} is a CompletionException with a cause, otherwise
   *         {@code throwable}
   */
  public static Throwable unwrap(final Throwable throwable) {
    if (throwable instanceof CompletionException && throwable.getCause() != null) {
      return throwable.getCause();
    }
    return throwable;
  }

  /**
   * Uses the possibly exceptional result of {@code stage} to produce a new stage.
   *
   * <p>
   * When {@code stage} completes, {@code fn} is applied with the result of the stage (or null if it
   * completed exceptionally) and the exception from the stage (or null if it completed normally).
   * The returned stage is completed with the outcome of the stage produced by {@code fn}.
   *
   * @param stage a {@link CompletionStage} that may complete exceptionally
   * @param fn a function that runs with the outcome of {@code stage} to produce a new stage
   * @return a {@link CompletionStage} which will complete with the result of {@code fn}
   * @see CompletionStage#handle(BiFunction)
   */
  public static <T, U> CompletionStage<U> thenComposeOrRecover(
      final CompletionStage<T> stage,
      final BiFunction<? super T, Throwable, ? extends CompletionStage<U>> fn) {
    final CompletableFuture<U> ret = new CompletableFuture<>();
    stage.whenComplete((t, throwable) -> {
      try {
        fn.apply(t, throwable).whenComplete((u, ex2) -> {
          if (ex2 != null) {
            ret.completeExceptionally(ex2);
          } else {
            ret.complete(u);
          }
        });
      } catch (final Throwable e) {
        ret.completeExceptionally(e);
      }
    });
    return ret;
  }
}
