/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.collection;

import java.util.concurrent.CompletionStage;

import io.collectkit.iteration.LazySequence;
import io.collectkit.util.Either;
import io.collectkit.util.StageSupport;

/**
 * Walks a {@link Collected} in consecutive slices of a fixed size. Each pull copies exactly one
 * slice, so at most one slice beyond the backing collection is alive at a time.
 *
 * <p>
 * The cursor starts at offset 0. A pull at an offset below the collection size yields
 * {@code slice(offset, offset + size)} and advances the offset by {@code size}; any other pull
 * yields {@link End}. Closing the cursor moves it to the end.
 */
final class SliceCursor<T> implements LazySequence<Collected<T>> {
  private final Collected<T> source;
  private final int size;
  private int offset;

  SliceCursor(final Collected<T> source, final int size) {
    if (size <= 0) {
      throw new IllegalArgumentException("cursor size must be positive, given " + size);
    }
    this.source = source;
    this.size = size;
  }

  @Override
  public CompletionStage<Either<End, Collected<T>>> nextStage() {
    if (this.offset >= this.source.size()) {
      return End.endStage();
    }
    final int from = this.offset;
    this.offset = (int) Math.min((long) from + this.size, this.source.size());
    return StageSupport.completedStage(Either.right(this.source.slice(from, this.offset)));
  }

  @Override
  public CompletionStage<Void> close() {
    this.offset = this.source.size();
    return StageSupport.voidStage();
  }

  @Override
  public String toString() {
    return "SliceCursor [offset=" + this.offset + ", size=" + this.size + ", length="
        + this.source.size() + "]";
  }
}
