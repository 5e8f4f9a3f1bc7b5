/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.collection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import io.collectkit.iteration.AsyncTrampoline;
import io.collectkit.iteration.LazySequence;
import io.collectkit.parallel.BoundedScheduler;
import io.collectkit.parallel.ParallelOptions;
import io.collectkit.util.Combinators;
import io.collectkit.util.StageSupport;

/**
 * An immutable, ordered, realized collection of items, and the entry point to the deferred
 * facilities of this library.
 *
 * <p>
 * Operators on this class are <i>eager</i>: each one materializes a new backing list at once.
 * {@link #lazy()} switches to deferred evaluation, {@link #cursor(int)} walks the items in
 * fixed-size slices, and {@link #parallel(Function, ParallelOptions)} runs an asynchronous handler
 * over partitions of the items with bounded concurrency.
 *
 * <pre>
 * {@code
 * Collected<Integer> numbers = Collected.range(1, 1_000_000);
 *
 * // deferred: only the first ten items are ever looked at
 * CompletionStage<List<Integer>> firstDoubledEvens =
 *     numbers.lazy().filter(x -> x % 2 == 0).map(x -> x * 2).take(5).toList();
 *
 * // bounded concurrency: at most 2 slices in flight
 * CompletionStage<Collected<Long>> sums = numbers.parallel(
 *     slice -> service.sumAsync(slice),
 *     ParallelOptions.builder().chunks(8).maxConcurrency(2).build());
 * }
 * </pre>
 *
 * @param <T> the type of the items
 */
public final class Collected<T> implements Iterable<T> {

  private static final Collected<?> EMPTY = new Collected<>(Collections.emptyList());

  private final List<T> items;

  private Collected(final List<T> items) {
    this.items = items;
  }

  /**
   * Creates a collection holding a snapshot of {@code items}, in iteration order.
   */
  public static <T> Collected<T> collect(final Iterable<? extends T> items) {
    Objects.requireNonNull(items);
    final List<T> copy;
    if (items instanceof Collection) {
      copy = new ArrayList<>((Collection<? extends T>) items);
    } else {
      copy = new ArrayList<>();
      for (final T t : items) {
        copy.add(t);
      }
    }
    return wrap(copy);
  }

  @SafeVarargs
  public static <T> Collected<T> of(final T... items) {
    return wrap(new ArrayList<>(Arrays.asList(items)));
  }

  @SuppressWarnings("unchecked")
  public static <T> Collected<T> empty() {
    return (Collected<T>) EMPTY;
  }

  /**
   * Creates the collection of integers from {@code start} to {@code end}, both inclusive.
   */
  public static Collected<Integer> range(final int start, final int end) {
    return range(start, end, 1);
  }

  /**
   * Creates the collection {@code start, start + step, ...} of the values not greater than
   * {@code end}.
   *
   * @throws IllegalArgumentException if {@code step} is not positive
   */
  public static Collected<Integer> range(final int start, final int end, final int step) {
    if (step <= 0) {
      throw new IllegalArgumentException("range step must be positive, given " + step);
    }
    final List<Integer> values = new ArrayList<>(Math.max(0, (end - start) / step + 1));
    for (long i = start; i <= end; i += step) {
      values.add((int) i);
    }
    return wrap(values);
  }

  /**
   * Creates a collection of {@code n} items produced by {@code fn} from the indexes {@code 0} to
   * {@code n - 1}.
   */
  public static <T> Collected<T> times(final int n, final IntFunction<? extends T> fn) {
    if (n < 0) {
      throw new IllegalArgumentException("times count must be non-negative, given " + n);
    }
    final List<T> values = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      values.add(fn.apply(i));
    }
    return wrap(values);
  }

  /**
   * Drains a deferred sequence into a collection.
   *
   * @return a stage of the realized items of {@code sequence}, in order
   */
  public static <T> CompletionStage<Collected<T>> drain(final LazySequence<T> sequence) {
    return sequence.toList().thenApply(Collected::wrap);
  }

  private static <T> Collected<T> wrap(final List<T> owned) {
    return owned.isEmpty() ? empty() : new Collected<>(Collections.unmodifiableList(owned));
  }

  /** @return an unmodifiable view of the items */
  public List<T> items() {
    return this.items;
  }

  /** @return a new mutable list of the items */
  public List<T> toList() {
    return new ArrayList<>(this.items);
  }

  public int size() {
    return this.items.size();
  }

  public boolean isEmpty() {
    return this.items.isEmpty();
  }

  public boolean isNotEmpty() {
    return !this.items.isEmpty();
  }

  public T get(final int index) {
    return this.items.get(index);
  }

  public Optional<T> first() {
    return this.items.isEmpty() ? Optional.empty() : Optional.ofNullable(this.items.get(0));
  }

  public Optional<T> last() {
    return this.items.isEmpty()
        ? Optional.empty()
        : Optional.ofNullable(this.items.get(this.items.size() - 1));
  }

  @Override
  public Iterator<T> iterator() {
    return this.items.iterator();
  }

  public <U> Collected<U> map(final Function<? super T, ? extends U> fn) {
    final List<U> mapped = new ArrayList<>(this.items.size());
    for (final T t : this.items) {
      mapped.add(fn.apply(t));
    }
    return wrap(mapped);
  }

  public Collected<T> filter(final Predicate<? super T> predicate) {
    return wrap(this.items.stream().filter(predicate).collect(Collectors.toList()));
  }

  public <U> Collected<U> flatMap(final Function<? super T, ? extends Iterable<? extends U>> fn) {
    final List<U> flattened = new ArrayList<>();
    for (final T t : this.items) {
      for (final U u : fn.apply(t)) {
        flattened.add(u);
      }
    }
    return wrap(flattened);
  }

  public Collected<T> take(final int n) {
    if (n < 0) {
      throw new IllegalArgumentException("take count must be non-negative, given " + n);
    }
    return slice(0, Math.min(n, this.items.size()));
  }

  public Collected<T> skip(final int n) {
    if (n < 0) {
      throw new IllegalArgumentException("skip count must be non-negative, given " + n);
    }
    return slice(Math.min(n, this.items.size()), this.items.size());
  }

  /**
   * Copies the items in {@code [from, to)} into a new collection; bounds are clamped to the
   * collection.
   */
  public Collected<T> slice(final int from, final int to) {
    final int start = Math.max(0, Math.min(from, this.items.size()));
    final int end = Math.max(start, Math.min(to, this.items.size()));
    if (start == 0 && end == this.items.size()) {
      return this;
    }
    return wrap(new ArrayList<>(this.items.subList(start, end)));
  }

  /**
   * Splits the items into consecutive slices of {@code size} items; the last slice may be smaller.
   *
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  public Collected<Collected<T>> chunk(final int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("chunk size must be positive, given " + size);
    }
    final List<Collected<T>> chunks = new ArrayList<>((this.items.size() + size - 1) / size);
    for (int offset = 0; offset < this.items.size(); offset += size) {
      chunks.add(slice(offset, offset + size));
    }
    return wrap(chunks);
  }

  public <U> U reduce(final U identity, final BiFunction<U, ? super T, U> accumulator) {
    U acc = identity;
    for (final T t : this.items) {
      acc = accumulator.apply(acc, t);
    }
    return acc;
  }

  /**
   * Returns the items of page {@code page} (1-based) of {@code perPage} items.
   */
  public Collected<T> forPage(final int page, final int perPage) {
    if (perPage <= 0) {
      throw new IllegalArgumentException("page size must be positive, given " + perPage);
    }
    final long offset = (long) (page - 1) * perPage;
    if (offset < 0 || offset >= this.items.size()) {
      return empty();
    }
    return slice((int) offset, (int) Math.min(offset + perPage, this.items.size()));
  }

  /**
   * Builds the page {@code page} (1-based, clamped to the existing pages) of {@code perPage} items.
   */
  public Page<T> paginate(final int perPage, final int page) {
    if (perPage <= 0) {
      throw new IllegalArgumentException("page size must be positive, given " + perPage);
    }
    final int lastPage = (this.items.size() + perPage - 1) / perPage;
    final int currentPage = Math.min(Math.max(page, 1), Math.max(lastPage, 1));
    return new Page<>(forPage(currentPage, perPage), this.items.size(), perPage, currentPage,
        lastPage);
  }

  /**
   * Builds a lookup table from the key produced by {@code keyFn} to the items with that key. This
   * collection is not modified; the returned decorator holds both.
   */
  public <K> Indexed<K, T> indexBy(final Function<? super T, ? extends K> keyFn) {
    return Indexed.build(this, keyFn);
  }

  /**
   * Starts all invocations of {@code fn} at once and collects their results in item order.
   */
  public <U> CompletionStage<Collected<U>> mapAsync(
      final Function<? super T, ? extends CompletionStage<U>> fn) {
    final List<CompletionStage<U>> stages = new ArrayList<>(this.items.size());
    for (final T t : this.items) {
      stages.add(StageSupport.convertSynchronousException(() -> fn.apply(t)));
    }
    return Combinators.collect(stages).thenApply(Collected::wrap);
  }

  /**
   * Starts all predicate invocations at once and keeps the items whose predicate completed with
   * true, in item order.
   */
  public CompletionStage<Collected<T>> filterAsync(
      final Function<? super T, ? extends CompletionStage<Boolean>> predicate) {
    return mapAsync(predicate).thenApply(keep -> {
      final List<T> kept = new ArrayList<>();
      for (int i = 0; i < this.items.size(); i++) {
        if (Boolean.TRUE.equals(keep.get(i))) {
          kept.add(this.items.get(i));
        }
      }
      return wrap(kept);
    });
  }

  /**
   * Folds the items sequentially, waiting for each step before starting the next.
   */
  public <U> CompletionStage<U> reduceAsync(
      final U identity, final BiFunction<U, ? super T, ? extends CompletionStage<U>> accumulator) {
    final Iterator<T> it = this.items.iterator();
    return AsyncTrampoline.asyncWhile(
        acc -> it.hasNext(),
        acc -> accumulator.apply(acc, it.next()),
        identity);
  }

  public CompletionStage<Boolean> everyAsync(
      final Function<? super T, ? extends CompletionStage<Boolean>> predicate) {
    return mapAsync(predicate).thenApply(
        results -> results.items.stream().allMatch(Boolean.TRUE::equals));
  }

  public CompletionStage<Boolean> someAsync(
      final Function<? super T, ? extends CompletionStage<Boolean>> predicate) {
    return mapAsync(predicate).thenApply(
        results -> results.items.stream().anyMatch(Boolean.TRUE::equals));
  }

  /**
   * Starts a deferred pipeline over a snapshot of the items. Each call returns an independent,
   * single-pass sequence.
   */
  public LazySequence<T> lazy() {
    return LazySequence.of(this.items);
  }

  /**
   * Walks the items in consecutive slices of {@code size} items, computing each slice only when it
   * is pulled.
   *
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  public LazySequence<Collected<T>> cursor(final int size) {
    return new SliceCursor<>(this, size);
  }

  /**
   * Runs {@code handler} over partitions of the items with bounded concurrency. The results are
   * collected in completion order, not partition order.
   *
   * @see BoundedScheduler
   */
  public <U> CompletionStage<Collected<U>> parallel(
      final Function<? super Collected<T>, ? extends CompletionStage<U>> handler,
      final ParallelOptions options) {
    return new BoundedScheduler(options).run(this, handler);
  }

  /**
   * Runs {@code handler} with {@link ParallelOptions#defaults() default options}.
   */
  public <U> CompletionStage<Collected<U>> parallel(
      final Function<? super Collected<T>, ? extends CompletionStage<U>> handler) {
    return parallel(handler, ParallelOptions.defaults());
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof Collected && this.items.equals(((Collected<?>) obj).items);
  }

  @Override
  public int hashCode() {
    return this.items.hashCode();
  }

  @Override
  public String toString() {
    return "Collected" + this.items;
  }
}
