/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.iteration;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import io.collectkit.util.StageSupport;

/**
 * Static methods for asynchronous loops that do not grow the stack.
 *
 * <p>
 * A pipeline stage such as {@link LazySequence#filter(Predicate)} keeps pulling its upstream until
 * an item passes. Written as recursion on {@link CompletionStage#thenCompose(Function)}, this
 * overflows the stack as soon as the upstream answers synchronously, which is the normal case for a
 * sequence backed by an in-memory list:
 *
 * <pre>
 * {@code
 * CompletionStage<Either<End, T>> pullUntilMatch() {
 *   return upstream.nextStage().thenCompose(e -> matches(e)
 *       ? CompletableFuture.completedFuture(e)
 *       : pullUntilMatch()); // recursion depth == number of rejected items
 * }
 * }
 * </pre>
 *
 * The methods on this class run such loops iteratively: when the loop body completes on the same
 * thread that is still unrolling the loop, the value is handed back to that frame instead of
 * recursing.
 *
 * <pre>
 * {@code
 * AsyncTrampoline.asyncWhile(e -> !matches(e), e -> upstream.nextStage(), first);
 * }
 * </pre>
 *
 * @see LazySequence
 */
public final class AsyncTrampoline {

  private AsyncTrampoline() {}

  private static class TrampolineInternal<T> extends CompletableFuture<T> {

    private final Predicate<? super T> shouldContinue;
    private final Function<? super T, ? extends CompletionStage<T>> f;

    private TrampolineInternal(
        final Predicate<? super T> shouldContinue,
        final Function<? super T, ? extends CompletionStage<T>> f,
        final T initialValue) {
      this.shouldContinue = shouldContinue;
      this.f = f;
      unroll(initialValue, null, null);
    }

    private void unroll(
        final T completed, final Thread previousThread, final PassBack previousPassBack) {
      final Thread currentThread = Thread.currentThread();

      // the frame that started the loop on this thread is still running; hand the value back to it
      if (currentThread.equals(previousThread) && previousPassBack.isRunning) {
        previousPassBack.offer(completed);
        return;
      }

      final PassBack currentPassBack = new PassBack();
      T c = completed;
      while (true) {
        try {
          if (!this.shouldContinue.test(c)) {
            complete(c);
            return;
          }
          this.f.apply(c).whenComplete((next, ex) -> {
            if (ex != null) {
              completeExceptionally(ex);
            } else {
              unroll(next, currentThread, currentPassBack);
            }
          });
        } catch (final Throwable e) {
          completeExceptionally(e);
          return;
        }
        if (!currentPassBack.hasItem) {
          // the body is still pending; its completion will start a new frame
          currentPassBack.isRunning = false;
          return;
        }
        c = currentPassBack.poll();
      }
    }

    private class PassBack {
      boolean isRunning = true;
      boolean hasItem = false;
      T item = null;

      void offer(final T t) {
        this.item = t;
        this.hasItem = true;
      }

      T poll() {
        final T t = this.item;
        this.item = null;
        this.hasItem = false;
        return t;
      }
    }
  }

  /**
   * Repeatedly applies an asynchronous function {@code fn} to a value until {@code shouldContinue}
   * returns {@code false}. The asynchronous equivalent of
   *
   * <pre>
   * {@code
   * T t = initialValue;
   * while (shouldContinue.test(t)) {
   *   t = fn.apply(t);
   * }
   * return t;
   * }
   * </pre>
   *
   * The predicate is applied to {@code initialValue} as well. If the predicate or {@code fn} throw,
   * or a stage produced by {@code fn} completes exceptionally, looping stops and the returned stage
   * completes exceptionally.
   *
   * @param shouldContinue applied to every intermediate value, including {@code initialValue}
   * @param fn the loop body producing the next value
   * @param initialValue the first value tested and passed to {@code fn}
   * @return a stage of the first value that fails {@code shouldContinue}
   */
  public static <T> CompletionStage<T> asyncWhile(
      final Predicate<? super T> shouldContinue,
      final Function<? super T, ? extends CompletionStage<T>> fn,
      final T initialValue) {
    return new TrampolineInternal<>(shouldContinue, fn, initialValue);
  }

  /**
   * Repeatedly uses {@code fn} to produce a stage of a boolean, stopping once the boolean is
   * {@code false}. The asynchronous equivalent of {@code while (fn.get());}, so {@code fn} must
   * perform some side effect to be useful.
   *
   * @param fn a supplier of a stage that indicates whether looping should continue
   * @return a stage that completes when a stage produced by {@code fn} yields {@code false}, or
   *         exceptionally if one was thrown
   */
  public static CompletionStage<Void> asyncWhile(
      final Supplier<? extends CompletionStage<Boolean>> fn) {
    return StageSupport.voided(AsyncTrampoline.asyncWhile(b -> b, b -> fn.get(), true));
  }

  /**
   * Like {@link #asyncWhile(Predicate, Function, Object)}, but unconditionally applies {@code fn}
   * to {@code initialValue} before the first test.
   *
   * @param fn the loop body producing the next value
   * @param initialValue the value first passed to {@code fn}, never tested
   * @param shouldContinue applied to every value produced by {@code fn}
   * @return a stage of the first produced value that fails {@code shouldContinue}
   */
  public static <T> CompletionStage<T> asyncDoWhile(
      final Function<? super T, ? extends CompletionStage<T>> fn,
      final T initialValue,
      final Predicate<? super T> shouldContinue) {
    return StageSupport.convertSynchronousException(() -> fn.apply(initialValue))
        .thenCompose(t -> AsyncTrampoline.asyncWhile(shouldContinue, fn, t));
  }
}
