/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.iteration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collector;

import io.collectkit.iteration.LazySequence.End;
import io.collectkit.util.Either;
import io.collectkit.util.StageSupport;

/** Package private stage implementations used by {@link LazySequence} */
class LazySequences {

  private LazySequences() {}

  static final LazySequence<?> EMPTY_SEQUENCE = new LazySequence<Object>() {
    @Override
    public CompletionStage<Either<End, Object>> nextStage() {
      return End.endStage();
    }

    @Override
    public String toString() {
      return "EmptySequence";
    }
  };

  /*
   * Loop marker for stages that pull upstream until they have something to yield. Compared by
   * identity, so a legitimate null item is never mistaken for it
   */
  private static final Either<End, ?> PENDING = Either.right(null);

  @SuppressWarnings("unchecked")
  private static <T> Either<End, T> pending() {
    return (Either<End, T>) PENDING;
  }

  private static boolean isPending(final Either<End, ?> either) {
    return either == PENDING;
  }

  @SuppressWarnings("unchecked")
  static <A, R> R finishContainer(final A accumulator, final Collector<?, A, R> collector) {
    // cast instead of applying the finishing function if the collector indicates the
    // finishing function is just identity
    return collector.characteristics().contains(Collector.Characteristics.IDENTITY_FINISH)
        ? ((R) accumulator)
        : collector.finisher().apply(accumulator);
  }

  /** Sequence source over a realized list; holds only a read position */
  static final class ListSource<T> implements LazySequence<T> {
    private final List<? extends T> items;
    private int position;
    private boolean closed;

    ListSource(final List<? extends T> items) {
      this.items = items;
    }

    @Override
    public CompletionStage<Either<End, T>> nextStage() {
      if (this.closed || this.position >= this.items.size()) {
        return End.endStage();
      }
      return StageSupport.completedStage(Either.right(this.items.get(this.position++)));
    }

    @Override
    public CompletionStage<Void> close() {
      this.closed = true;
      return StageSupport.voidStage();
    }

    @Override
    public String toString() {
      return "ListSource[position=" + this.position + ", size=" + this.items.size()
          + (this.closed ? ", closed]" : "]");
    }
  }

  static <T, U> LazySequence<U> mapImpl(
      final LazySequence<T> upstream, final Function<? super T, ? extends U> fn) {
    return new LazySequence<U>() {
      @Override
      public CompletionStage<Either<End, U>> nextStage() {
        return upstream.nextStage().thenApply(either -> either.map(fn));
      }

      @Override
      public CompletionStage<Void> close() {
        return upstream.close();
      }
    };
  }

  static <T, U> LazySequence<U> mapAsyncImpl(
      final LazySequence<T> upstream,
      final Function<? super T, ? extends CompletionStage<U>> fn) {
    return new LazySequence<U>() {
      @Override
      public CompletionStage<Either<End, U>> nextStage() {
        return upstream.nextStage().thenCompose(this::apply);
      }

      /* apply fn if there's an item, otherwise pass the end marker along */
      private CompletionStage<Either<End, U>> apply(final Either<End, T> either) {
        return either.fold(
            end -> End.endStage(),
            t -> fn.apply(t).thenApply(Either::right));
      }

      @Override
      public CompletionStage<Void> close() {
        return upstream.close();
      }
    };
  }

  static final class FilterAsyncSequence<T> implements LazySequence<T> {
    private final LazySequence<T> upstream;
    private final Function<? super T, ? extends CompletionStage<Boolean>> predicate;

    FilterAsyncSequence(
        final LazySequence<T> upstream,
        final Function<? super T, ? extends CompletionStage<Boolean>> predicate) {
      this.upstream = upstream;
      this.predicate = predicate;
    }

    @Override
    public CompletionStage<Either<End, T>> nextStage() {
      return AsyncTrampoline.asyncWhile(
          LazySequences::isPending,
          ig -> this.upstream.nextStage().thenCompose(this::test),
          LazySequences.<T>pending());
    }

    private CompletionStage<Either<End, T>> test(final Either<End, T> either) {
      if (!either.isRight()) {
        return StageSupport.completedStage(either);
      }
      final T t = either.fold(end -> null, item -> item);
      return this.predicate.apply(t)
          .thenApply(keep -> Boolean.TRUE.equals(keep) ? either : LazySequences.<T>pending());
    }

    @Override
    public CompletionStage<Void> close() {
      return this.upstream.close();
    }
  }

  static final class FlatMapSequence<T, U> implements LazySequence<U> {
    private final LazySequence<T> upstream;
    private final Function<? super T, ? extends Iterable<? extends U>> fn;
    private Iterator<? extends U> current = Collections.emptyIterator();

    FlatMapSequence(
        final LazySequence<T> upstream,
        final Function<? super T, ? extends Iterable<? extends U>> fn) {
      this.upstream = upstream;
      this.fn = fn;
    }

    @Override
    public CompletionStage<Either<End, U>> nextStage() {
      if (this.current.hasNext()) {
        return StageSupport.completedStage(Either.right(this.current.next()));
      }
      // current group is used up, pull upstream until a non-empty group or the end
      return AsyncTrampoline.asyncWhile(
          LazySequences::isPending,
          ig -> this.upstream.nextStage().thenApply(this::expand),
          LazySequences.<U>pending());
    }

    private Either<End, U> expand(final Either<End, T> either) {
      if (!either.isRight()) {
        return End.end();
      }
      this.current = this.fn.apply(either.fold(end -> null, t -> t)).iterator();
      return this.current.hasNext() ? Either.right(this.current.next()) : pending();
    }

    @Override
    public CompletionStage<Void> close() {
      this.current = Collections.emptyIterator();
      return this.upstream.close();
    }
  }

  static final class SkipSequence<T> implements LazySequence<T> {
    private final LazySequence<T> upstream;
    private long remaining;

    SkipSequence(final LazySequence<T> upstream, final long n) {
      this.upstream = upstream;
      this.remaining = n;
    }

    @Override
    public CompletionStage<Either<End, T>> nextStage() {
      if (this.remaining <= 0) {
        return this.upstream.nextStage();
      }
      return this.upstream.nextStage().thenCompose(first -> AsyncTrampoline.asyncWhile(
          this::discard,
          ig -> this.upstream.nextStage(),
          first));
    }

    private boolean discard(final Either<End, T> either) {
      if (either.isRight() && this.remaining > 0) {
        this.remaining--;
        return true;
      }
      return false;
    }

    @Override
    public CompletionStage<Void> close() {
      return this.upstream.close();
    }
  }

  static final class SkipWhileSequence<T> implements LazySequence<T> {
    private final LazySequence<T> upstream;
    private final Predicate<? super T> predicate;
    private boolean skipping = true;

    SkipWhileSequence(final LazySequence<T> upstream, final Predicate<? super T> predicate) {
      this.upstream = upstream;
      this.predicate = predicate;
    }

    @Override
    public CompletionStage<Either<End, T>> nextStage() {
      if (!this.skipping) {
        return this.upstream.nextStage();
      }
      return this.upstream.nextStage()
          .thenCompose(first -> AsyncTrampoline.asyncWhile(
              either -> either.fold(end -> false, this.predicate::test),
              ig -> this.upstream.nextStage(),
              first))
          .thenApply(either -> {
            this.skipping = false;
            return either;
          });
    }

    @Override
    public CompletionStage<Void> close() {
      return this.upstream.close();
    }
  }

  static final class ChunkSequence<T> implements LazySequence<List<T>> {
    private final LazySequence<T> upstream;
    private final int size;
    private boolean exhausted;

    ChunkSequence(final LazySequence<T> upstream, final int size) {
      this.upstream = upstream;
      this.size = size;
    }

    @Override
    public CompletionStage<Either<End, List<T>>> nextStage() {
      if (this.exhausted) {
        return End.endStage();
      }
      final List<T> group = new ArrayList<>(this.size);
      return AsyncTrampoline.asyncWhile(
          more -> more && group.size() < this.size,
          ig -> this.upstream.nextStage().thenApply(either -> either.fold(
              end -> {
                this.exhausted = true;
                return false;
              },
              t -> {
                group.add(t);
                return true;
              })),
          true)
          .thenApply(ig -> group.isEmpty()
              ? End.<List<T>>end()
              : Either.<End, List<T>>right(Collections.unmodifiableList(group)));
    }

    @Override
    public CompletionStage<Void> close() {
      this.exhausted = true;
      return this.upstream.close();
    }
  }

  static final class ConcatSequence<T> implements LazySequence<T> {
    private final Iterator<? extends LazySequence<T>> sequences;
    private LazySequence<T> current;

    ConcatSequence(final Iterator<? extends LazySequence<T>> sequences) {
      this.sequences = sequences;
      this.current = sequences.next();
    }

    @Override
    public CompletionStage<Either<End, T>> nextStage() {
      return StageSupport.convertSynchronousException(this.current::nextStage)
          .thenCompose(first -> AsyncTrampoline.asyncWhile(
              either -> !either.isRight() && this.sequences.hasNext(),
              either -> StageSupport.thenComposeOrRecover(
                  StageSupport.convertSynchronousException(this.current::close),
                  (ig, closeEx) -> {
                    if (closeEx != null) {
                      return StageSupport.<Either<End, T>>exceptionalStage(closeEx);
                    }
                    this.current = this.sequences.next();
                    return this.current.nextStage();
                  }),
              first));
    }

    @Override
    public CompletionStage<Void> close() {
      return this.current.close();
    }

    @Override
    public String toString() {
      return "ConcatSequence[current=" + this.current + "]";
    }
  }

  /** Holder for a pairwise reduction that has no identity */
  static final class Accumulator<T> {
    private boolean present;
    private T value;

    void accept(final T t, final BinaryOperator<T> fn) {
      if (this.present) {
        this.value = fn.apply(this.value, t);
      } else {
        this.value = t;
        this.present = true;
      }
    }

    Optional<T> result() {
      return this.present ? Optional.ofNullable(this.value) : Optional.empty();
    }
  }
}
