/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.iteration;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collector;
import java.util.stream.Stream;

import io.collectkit.util.AsyncCloseable;
import io.collectkit.util.Either;
import io.collectkit.util.StageSupport;

/**
 * A deferred, pull based sequence of items.
 *
 * <p>
 * Consider this an asynchronous version of {@link Stream} restricted to sequential, ordered
 * evaluation. LazySequences have lazy evaluation semantics: nothing is computed until a terminal
 * method pulls, and only what is needed to satisfy that terminal method is pulled from upstream.
 * LazySequences are single-pass: each item is produced once, and re-driving an exhausted sequence
 * yields no further items rather than starting again.
 *
 * <p>
 * Implementors need only implement {@link #nextStage()}. Most users obtain a sequence from a
 * realized collection, or from one of the static constructors such as {@link #of(List)},
 * {@link #fromIterator(Iterator)} or {@link #generate(Supplier)}, then compose zero or more
 * <i>intermediate</i> methods and finish with a <i>terminal</i> method:
 *
 * <pre>
 * {@code
 * CompletionStage<List<Integer>> firstDoubledEvens =
 *     LazySequence.of(numbers)        // source
 *         .filter(x -> x % 2 == 0)    // intermediate
 *         .map(x -> x * 2)            // intermediate
 *         .take(5)                    // intermediate
 *         .toList();                  // terminal
 * }
 * </pre>
 *
 * <p>
 * <b>Intermediate methods</b> return a new LazySequence that owns a reference to {@code this}.
 * They never reorder items. Asking a transformed sequence for one item pulls exactly one upstream
 * item for one-to-one stages ({@link #map(Function)}), possibly many for stages that discard
 * ({@link #filter(Predicate)}, {@link #skip(long)}), and none once a bounding stage is satisfied
 * ({@link #take(long)}, {@link #takeWhile(Predicate)}). Argument errors, such as a negative count,
 * are thrown synchronously when the stage is composed.
 *
 * <p>
 * <b>Terminal methods</b> drive the sequence and return a {@link CompletionStage}. After a terminal
 * method is called the sequence is consumed. If a user callback throws, or any upstream stage
 * completes exceptionally, the terminal stage completes exceptionally with that error and stops
 * pulling; items already handed to a callback (for instance by {@link #forEach(Consumer)}) are not
 * retracted, and materializing methods never return a partial result.
 *
 * <p>
 * A note on thread safety: {@link #nextStage()} must not be called again until the stage returned
 * by the previous call has completed. Intermediate stages rely on this and hold unsynchronized
 * state.
 *
 * <p>
 * Unless otherwise noted, methods on this interface throw {@link NullPointerException} if any of
 * the provided arguments are {@code null}.
 *
 * @param <T> Type of the items in this sequence
 */
public interface LazySequence<T> extends AsyncCloseable {

  /** A marker enum that indicates there are no items left in the sequence. */
  enum End {
    END;

    private static final Either<End, ?> SEQUENCE_END = Either.left(End.END);

    private static final CompletionStage<? extends Either<End, ?>> END_STAGE =
        CompletableFuture.completedFuture(SEQUENCE_END);

    /**
     * An {@link Either} instance which contains the {@link End} enum.
     */
    @SuppressWarnings("unchecked")
    public static <T> Either<End, T> end() {
      return (Either<End, T>) SEQUENCE_END;
    }

    /**
     * A {@link CompletionStage} which is already complete, and contains the {@link End#end()}
     * instance as its value.
     */
    @SuppressWarnings("unchecked")
    public static <T> CompletionStage<Either<End, T>> endStage() {
      return (CompletionStage<Either<End, T>>) END_STAGE;
    }

    @Override
    public String toString() {
      return "End of sequence";
    }
  }

  /**
   * Pulls the next item. The returned stage completes with the item in the
   * {@link Either#right() right} position, or with {@link End} in the {@link Either#left() left}
   * position when the sequence is exhausted.
   *
   * <p>
   * This method is <b>not thread safe</b>: a subsequent call must not be made until the stage
   * returned by the previous call has completed.
   *
   * <pre>
   * {@code
   * // illegal
   * f1 = nextStage();
   * f2 = nextStage();
   *
   * // good
   * nextStage().thenCompose(e -> nextStage());
   * }
   * </pre>
   *
   * Unlike the terminal methods, nextStage may still be called after a returned stage completed
   * exceptionally; whether further items follow is up to the implementation.
   *
   * @return a {@link CompletionStage} of the next item, or of {@link End}
   */
  CompletionStage<Either<End, T>> nextStage();

  /**
   * Stops this sequence. Intermediate stages pass the call to their upstream, so closing the last
   * stage of a pipeline stops its source. {@link #take(long)}, {@link #takeWhile(Predicate)} and
   * {@link #findFirst(Predicate)} call this on their upstream once they are satisfied. The default
   * implementation does nothing.
   *
   * @return a {@link CompletionStage} that completes when the sequence has stopped
   */
  @Override
  default CompletionStage<Void> close() {
    return StageSupport.voidStage();
  }

  /**
   * Transforms {@code this} into a sequence of {@code fn} applied to each item.
   *
   * <pre>
   * {@code
   * intSequence // 1, 2, 3, ...
   *     .map(Integer::toString) // "1", "2", "3", ...
   * }
   * </pre>
   *
   * Each pull of the returned sequence pulls exactly one item from {@code this}. If {@code fn}
   * throws, the pull completes exceptionally with the thrown exception.
   *
   * @param fn A function which produces a U from the given T
   * @return A new sequence of the results of {@code fn}
   */
  default <U> LazySequence<U> map(final Function<? super T, ? extends U> fn) {
    return LazySequences.mapImpl(this, Objects.requireNonNull(fn));
  }

  /**
   * Transforms {@code this} into a sequence of the results of the stages produced by {@code fn}.
   * Each pull suspends until the stage for the corresponding item completes.
   *
   * <pre>
   * {@code
   * CompletionStage<Record> lookup(final RecordId id);
   * idSequence.mapAsync(this::lookup) // one lookup in flight at a time
   * }
   * </pre>
   *
   * @param fn A function which produces a new {@link CompletionStage} from a T
   * @return A new sequence of the results of the stages produced by {@code fn}
   */
  default <U> LazySequence<U> mapAsync(
      final Function<? super T, ? extends CompletionStage<U>> fn) {
    return LazySequences.mapAsyncImpl(this, Objects.requireNonNull(fn));
  }

  /**
   * Transforms {@code this} into a sequence that only contains the items of {@code this} that
   * satisfy {@code predicate}. A single pull of the returned sequence pulls from {@code this} until
   * a matching item is found or {@code this} is exhausted.
   *
   * @param predicate A function applied to each item, items for which it returns false are dropped
   * @return A new sequence of the items of {@code this} that satisfy {@code predicate}
   */
  default LazySequence<T> filter(final Predicate<? super T> predicate) {
    Objects.requireNonNull(predicate);

    // keep looking as long as the current item doesn't match and we're not out of items
    final Predicate<Either<End, T>> shouldKeepLooking =
        either -> either.fold(end -> false, predicate.negate()::test);

    return new LazySequence<T>() {
      @Override
      public CompletionStage<Either<End, T>> nextStage() {
        return LazySequence.this
            .nextStage()
            .thenCompose(
                t -> AsyncTrampoline.asyncWhile(
                    shouldKeepLooking,
                    c -> LazySequence.this.nextStage(),
                    t));
      }

      @Override
      public CompletionStage<Void> close() {
        return LazySequence.this.close();
      }
    };
  }

  /**
   * Like {@link #filter(Predicate)}, but the decision for each item is delivered asynchronously.
   *
   * @param predicate produces a stage that completes with true for items that should be kept
   * @return A new sequence of the items of {@code this} whose predicate stage completed with true
   */
  default LazySequence<T> filterAsync(
      final Function<? super T, ? extends CompletionStage<Boolean>> predicate) {
    return new LazySequences.FilterAsyncSequence<>(this, Objects.requireNonNull(predicate));
  }

  /**
   * Transforms each item of {@code this} into a finite group of items and yields the members of
   * each group in order, before the next item of {@code this} is pulled. Empty groups are skipped.
   *
   * <pre>
   * {@code
   * LazySequence.of(Arrays.asList(1, 2)).flatMap(i -> Arrays.asList(i, i * 10)) // 1, 10, 2, 20
   * }
   * </pre>
   *
   * @param fn produces the group for an item
   * @return A new sequence of the members of the produced groups
   */
  default <U> LazySequence<U> flatMap(
      final Function<? super T, ? extends Iterable<? extends U>> fn) {
    return new LazySequences.FlatMapSequence<>(this, Objects.requireNonNull(fn));
  }

  /**
   * Returns a sequence of at most {@code n} items of {@code this}. The returned sequence pulls
   * {@code this} at most {@code n} times: once {@code n} items have been yielded, the next pull
   * signals {@link End} without touching {@code this}, and {@code this} is {@link #close() closed}.
   *
   * @param n the maximum number of items to yield
   * @return A new sequence of the first {@code n} items of {@code this}
   * @throws IllegalArgumentException if {@code n} is negative
   */
  default LazySequence<T> take(final long n) {
    if (n < 0) {
      throw new IllegalArgumentException("take count must be non-negative, given " + n);
    }
    return new LazySequence<T>() {
      long count = 0;
      boolean stopped = false;

      @Override
      public CompletionStage<Either<End, T>> nextStage() {
        if (this.count >= n) {
          return stop();
        }
        this.count++;
        return LazySequence.this.nextStage();
      }

      private CompletionStage<Either<End, T>> stop() {
        if (this.stopped) {
          return End.endStage();
        }
        this.stopped = true;
        return LazySequence.this.close().thenApply(ig -> End.end());
      }

      @Override
      public CompletionStage<Void> close() {
        return LazySequence.this.close();
      }
    };
  }

  /**
   * Returns a sequence that discards the first {@code n} items of {@code this} and then yields the
   * rest. The discarded items are pulled when the returned sequence is first pulled.
   *
   * @param n the number of leading items to discard
   * @return A new sequence of the items of {@code this} after the first {@code n}
   * @throws IllegalArgumentException if {@code n} is negative
   */
  default LazySequence<T> skip(final long n) {
    if (n < 0) {
      throw new IllegalArgumentException("skip count must be non-negative, given " + n);
    }
    return new LazySequences.SkipSequence<>(this, n);
  }

  /**
   * Returns a sequence of the leading items of {@code this} that satisfy {@code predicate}. The
   * first item that fails the predicate is neither yielded nor kept; {@code this} is
   * {@link #close() closed} at that point and never pulled again.
   *
   * <pre>
   * {@code
   * intSequence // 1, 2, 3, 4, 1
   *   .takeWhile(i -> i < 3) // 1, 2
   * }
   * </pre>
   *
   * @param predicate the condition an item must satisfy to be yielded
   * @return A new sequence of the matching prefix of {@code this}
   */
  default LazySequence<T> takeWhile(final Predicate<? super T> predicate) {
    Objects.requireNonNull(predicate);
    return new LazySequence<T>() {
      boolean predicateFailed = false;

      @Override
      public CompletionStage<Either<End, T>> nextStage() {
        if (this.predicateFailed) {
          return End.endStage();
        }
        return LazySequence.this.nextStage().thenCompose(this::check);
      }

      private CompletionStage<Either<End, T>> check(final Either<End, T> either) {
        if (!either.isRight()) {
          return StageSupport.completedStage(either);
        }
        final T t = either.fold(end -> null, item -> item);
        if (predicate.test(t)) {
          return StageSupport.completedStage(either);
        }
        this.predicateFailed = true;
        return LazySequence.this.close().thenApply(ig -> End.end());
      }

      @Override
      public CompletionStage<Void> close() {
        return LazySequence.this.close();
      }
    };
  }

  /**
   * Returns a sequence that discards the leading items of {@code this} that satisfy
   * {@code predicate}, then yields every remaining item, including later items that satisfy it.
   *
   * @param predicate the condition under which leading items are discarded
   * @return A new sequence of the items of {@code this} starting at the first non-matching item
   */
  default LazySequence<T> skipWhile(final Predicate<? super T> predicate) {
    return new LazySequences.SkipWhileSequence<>(this, Objects.requireNonNull(predicate));
  }

  /**
   * Groups the items of {@code this} into lists of {@code size} items; the last list may be
   * smaller. A pull of the returned sequence pulls {@code this} until {@code size} items have been
   * gathered or {@code this} is exhausted, and never reads ahead into the next group.
   *
   * <pre>
   * {@code
   * intSequence // 1, 2, 3, 4, 5
   *   .chunk(2) // [1, 2], [3, 4], [5]
   * }
   * </pre>
   *
   * @param size the number of items per group
   * @return A new sequence of unmodifiable lists of consecutive items
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  default LazySequence<List<T>> chunk(final int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("chunk size must be positive, given " + size);
    }
    return new LazySequences.ChunkSequence<>(this, size);
  }

  /**
   * Returns a sequence that recovers exceptional pulls of {@code this} by yielding the result of
   * {@code fn} applied to the exception. Exceptions thrown by stages downstream of the returned
   * sequence are not recovered.
   *
   * @param fn produces a replacement item from an exception
   * @return A new sequence in which exceptional pulls are replaced by items
   */
  default LazySequence<T> exceptionally(final Function<Throwable, ? extends T> fn) {
    Objects.requireNonNull(fn);
    return new LazySequence<T>() {
      @Override
      public CompletionStage<Either<End, T>> nextStage() {
        return StageSupport.convertSynchronousException(LazySequence.this::nextStage)
            .exceptionally(ex -> Either.right(fn.apply(ex)));
      }

      @Override
      public CompletionStage<Void> close() {
        return LazySequence.this.close();
      }
    };
  }

  /**
   * Returns a sequence that, once {@code this} has signalled {@link End}, answers every further
   * pull with {@link End} without pulling {@code this} again.
   *
   * @return A new sequence that stays exhausted
   */
  default LazySequence<T> fuse() {
    return new LazySequence<T>() {
      boolean end = false;

      @Override
      public CompletionStage<Either<End, T>> nextStage() {
        if (this.end) {
          return End.endStage();
        }
        return LazySequence.this
            .nextStage()
            .thenApply(
                either -> {
                  either.forEach(endMarker -> this.end = true, t -> {
                  });
                  return either;
                });
      }

      @Override
      public CompletionStage<Void> close() {
        return LazySequence.this.close();
      }
    };
  }

  /**
   * Performs {@code action} on every item of {@code this}, in order.
   *
   * <p>
   * This is a <i>terminal method</i>. If {@code action} throws, iteration stops and the returned
   * stage completes exceptionally; earlier invocations of {@code action} are not undone.
   *
   * @param action the side effect to run on each item
   * @return a {@link CompletionStage} that completes when every item has been processed
   */
  default CompletionStage<Void> forEach(final Consumer<? super T> action) {
    Objects.requireNonNull(action);
    return AsyncTrampoline.asyncWhile(
        () -> StageSupport.convertSynchronousException(this::nextStage)
            .thenApply(
                eitherT -> {
                  eitherT.forEach(
                      ig -> {
                      },
                      action);
                  return eitherT.isRight();
                }));
  }

  /**
   * Pulls every item of {@code this} and discards it.
   *
   * <p>
   * This is a <i>terminal method</i>.
   *
   * @return a {@link CompletionStage} that completes when {@code this} is exhausted
   */
  default CompletionStage<Void> consume() {
    return AsyncTrampoline.asyncWhile(
        () -> StageSupport.convertSynchronousException(this::nextStage)
            .thenApply(Either::isRight));
  }

  /**
   * Materializes the items of {@code this} with a {@link Collector}.
   *
   * <p>
   * This is a <i>terminal method</i>.
   *
   * @param collector a {@link Collector} applied to every item, in order
   * @return a {@link CompletionStage} of the collected result
   */
  default <R, A> CompletionStage<R> collect(final Collector<? super T, A, R> collector) {
    final A container = collector.supplier().get();
    final BiConsumer<A, ? super T> acc = collector.accumulator();
    return forEach(t -> acc.accept(container, t))
        .thenApply(ig -> LazySequences.finishContainer(container, collector));
  }

  /**
   * Materializes the items of {@code this} into a mutable container.
   *
   * <p>
   * This is a <i>terminal method</i>.
   *
   * @param supplier produces the container
   * @param accumulator adds an item to the container
   * @return a {@link CompletionStage} of the container after every item has been added
   */
  default <R> CompletionStage<R> collect(
      final Supplier<R> supplier, final BiConsumer<R, ? super T> accumulator) {
    final R container = supplier.get();
    return forEach(t -> accumulator.accept(container, t)).thenApply(ig -> container);
  }

  /**
   * Materializes the items of {@code this} into a list, in order. For a finite pipeline over a
   * finite source the list equals the result of applying the same operators eagerly.
   *
   * <p>
   * This is a <i>terminal method</i>.
   *
   * @return a {@link CompletionStage} of a new mutable list of the items
   */
  default CompletionStage<List<T>> toList() {
    return collect(ArrayList::new, List::add);
  }

  /**
   * Folds the items of {@code this} into an accumulator, starting from {@code identity}.
   *
   * <pre>
   * {@code
   * // sums the lengths of the strings
   * stringSequence.reduce(0, (acc, s) -> acc + s.length());
   * }
   * </pre>
   *
   * <p>
   * This is a <i>terminal method</i>.
   *
   * @param identity the initial accumulator
   * @param accumulator combines the accumulator with the next item
   * @return a {@link CompletionStage} of the final accumulator, {@code identity} if empty
   */
  default <U> CompletionStage<U> reduce(
      final U identity, final BiFunction<U, ? super T, U> accumulator) {
    Objects.requireNonNull(accumulator);
    @SuppressWarnings("unchecked")
    final U[] uarr = (U[]) new Object[] {identity};
    return this.collect(() -> uarr, (u, t) -> uarr[0] = accumulator.apply(uarr[0], t))
        .thenApply(arr -> arr[0]);
  }

  /**
   * Folds the items of {@code this} pairwise, using the first item as the initial accumulator.
   *
   * <p>
   * This is a <i>terminal method</i>.
   *
   * @param accumulator combines the accumulator with the next item
   * @return a {@link CompletionStage} of the reduction, or an empty Optional if {@code this} has
   *         no items
   */
  default CompletionStage<Optional<T>> reduce(final BinaryOperator<T> accumulator) {
    Objects.requireNonNull(accumulator);
    final LazySequences.Accumulator<T> acc = new LazySequences.Accumulator<>();
    return forEach(t -> acc.accept(t, accumulator)).thenApply(ig -> acc.result());
  }

  /**
   * Returns the first item of {@code this} that satisfies {@code predicate}.
   *
   * <p>
   * This is a <i>terminal method</i> that short circuits: it pulls {@code this} up to and including
   * the first matching item, then {@link #close() closes} {@code this}.
   *
   * @param predicate the condition to look for
   * @return a {@link CompletionStage} of the first match, or an empty Optional if {@code this} was
   *         exhausted first (or the match was {@code null})
   */
  default CompletionStage<Optional<T>> findFirst(final Predicate<? super T> predicate) {
    final LazySequence<T> matching = this.filter(predicate);
    return StageSupport.convertSynchronousException(matching::nextStage)
        .thenCompose(either -> either.fold(
            end -> StageSupport.completedStage(Optional.<T>empty()),
            t -> this.close().thenApply(ig -> Optional.ofNullable(t))));
  }

  /**
   * Returns the first item of {@code this}.
   *
   * <p>
   * This is a <i>terminal method</i> that short circuits: it pulls {@code this} exactly once and,
   * if an item was produced, {@link #close() closes} {@code this}.
   *
   * @return a {@link CompletionStage} of the first item, or an empty Optional if {@code this} had
   *         no items (or the item was {@code null})
   */
  default CompletionStage<Optional<T>> first() {
    return StageSupport.convertSynchronousException(this::nextStage)
        .thenCompose(either -> either.fold(
            end -> StageSupport.completedStage(Optional.<T>empty()),
            t -> this.close().thenApply(ig -> Optional.ofNullable(t))));
  }

  /**
   * Counts the items of {@code this}.
   *
   * <p>
   * This is a <i>terminal method</i>.
   */
  default CompletionStage<Long> count() {
    return reduce(0L, (c, t) -> c + 1);
  }

  /**
   * Sums a numeric projection of the items of {@code this}.
   *
   * <p>
   * This is a <i>terminal method</i>.
   */
  default CompletionStage<Double> sum(final ToDoubleFunction<? super T> fn) {
    Objects.requireNonNull(fn);
    return reduce(0.0, (acc, t) -> acc + fn.applyAsDouble(t));
  }

  /**
   * Averages a numeric projection of the items of {@code this}.
   *
   * <p>
   * This is a <i>terminal method</i>.
   *
   * @return a {@link CompletionStage} of the average, empty if {@code this} has no items
   */
  default CompletionStage<OptionalDouble> average(final ToDoubleFunction<? super T> fn) {
    Objects.requireNonNull(fn);
    return collect(() -> new double[2], (acc, t) -> {
      acc[0] += fn.applyAsDouble(t);
      acc[1]++;
    }).thenApply(acc -> acc[1] == 0 ? OptionalDouble.empty() : OptionalDouble.of(acc[0] / acc[1]));
  }

  /**
   * Returns the smallest item of {@code this} according to {@code comparator}; the first of equal
   * items wins.
   *
   * <p>
   * This is a <i>terminal method</i>.
   */
  default CompletionStage<Optional<T>> min(final Comparator<? super T> comparator) {
    Objects.requireNonNull(comparator);
    return reduce((a, b) -> comparator.compare(b, a) < 0 ? b : a);
  }

  /**
   * Returns the largest item of {@code this} according to {@code comparator}; the first of equal
   * items wins.
   *
   * <p>
   * This is a <i>terminal method</i>.
   */
  default CompletionStage<Optional<T>> max(final Comparator<? super T> comparator) {
    Objects.requireNonNull(comparator);
    return reduce((a, b) -> comparator.compare(b, a) > 0 ? b : a);
  }

  /**
   * Creates a sequence that yields the items of {@code items} in list order. The list is read, not
   * copied; it must not be modified while the sequence is in use. Once exhausted or
   * {@link #close() closed}, every pull returns {@link End}.
   *
   * @param items the realized items to produce
   * @return a sequence over {@code items}
   */
  static <T> LazySequence<T> of(final List<? extends T> items) {
    return new LazySequences.ListSource<>(Objects.requireNonNull(items));
  }

  /**
   * Creates an empty sequence.
   *
   * @return a sequence that always returns {@link End}
   */
  @SuppressWarnings("unchecked")
  static <T> LazySequence<T> empty() {
    return (LazySequence<T>) LazySequences.EMPTY_SEQUENCE;
  }

  /**
   * Creates a sequence of exactly one item.
   */
  static <T> LazySequence<T> once(final T t) {
    return new LazySequence<T>() {
      Either<End, T> curr = Either.right(t);

      @Override
      public CompletionStage<Either<End, T>> nextStage() {
        final Either<End, T> prev = this.curr;
        this.curr = End.end();
        return StageSupport.completedStage(prev);
      }
    };
  }

  /**
   * Creates a sequence whose every pull completes exceptionally with {@code ex}.
   */
  static <T> LazySequence<T> error(final Throwable ex) {
    final CompletionStage<Either<End, T>> stage = StageSupport.exceptionalStage(ex);
    return () -> stage;
  }

  /**
   * Creates a sequence backed by a synchronous {@link Iterator}.
   */
  static <T> LazySequence<T> fromIterator(final Iterator<? extends T> iterator) {
    Objects.requireNonNull(iterator);
    return () -> StageSupport.completedStage(
        iterator.hasNext() ? Either.right(iterator.next()) : End.end());
  }

  /**
   * Creates a sequence of the integers in {@code [start, end)}.
   */
  static LazySequence<Integer> range(final int start, final int end) {
    return new LazySequence<Integer>() {
      int counter = start;

      @Override
      public CompletionStage<Either<End, Integer>> nextStage() {
        if (this.counter < end) {
          return StageSupport.completedStage(Either.right(this.counter++));
        }
        return End.endStage();
      }
    };
  }

  /**
   * Creates an unbounded sequence of the integers starting at {@code start}. Must be bounded by a
   * downstream stage such as {@link #take(long)} before a materializing terminal method is used.
   */
  static LazySequence<Integer> infiniteRange(final int start) {
    return new LazySequence<Integer>() {
      int counter = start;

      @Override
      public CompletionStage<Either<End, Integer>> nextStage() {
        return StageSupport.completedStage(Either.right(this.counter++));
      }
    };
  }

  /**
   * Creates an unbounded sequence whose items are produced by stages from {@code supplier}.
   */
  static <T> LazySequence<T> generate(final Supplier<? extends CompletionStage<T>> supplier) {
    Objects.requireNonNull(supplier);
    return () -> supplier.get().thenApply(Either::right);
  }

  /**
   * Creates a sequence that starts with {@code seed} and produces each following item by applying
   * {@code fn} to the previous one, until {@code fn} returns {@link End}.
   */
  static <T> LazySequence<T> unfold(
      final T seed, final Function<? super T, ? extends CompletionStage<Either<End, T>>> fn) {
    Objects.requireNonNull(fn);
    return new LazySequence<T>() {
      CompletionStage<Either<End, T>> prev = StageSupport.completedStage(Either.right(seed));

      @Override
      public CompletionStage<Either<End, T>> nextStage() {
        final CompletionStage<Either<End, T>> ret = this.prev;
        this.prev = this.prev.thenCompose(nxt -> nxt.fold(end -> End.endStage(), fn));
        return ret;
      }
    };
  }

  /**
   * Creates a sequence that yields all items of each sequence of {@code sequences} in turn. Each
   * sequence is {@link #close() closed} once it is exhausted; closing the returned sequence closes
   * the current one.
   */
  static <T> LazySequence<T> concat(final Iterator<? extends LazySequence<T>> sequences) {
    if (!sequences.hasNext()) {
      return LazySequence.empty();
    }
    return new LazySequences.ConcatSequence<>(sequences);
  }
}
