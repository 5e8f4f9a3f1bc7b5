/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.util;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A value that holds exactly one of two mutually exclusive alternatives.
 *
 * <p>
 * Lazy sequences use this type as the outcome of a single pull: the {@link #right()} position holds
 * a produced item, and the {@link #left()} position holds the end-of-sequence marker. Because items
 * may legitimately be {@code null}, the optional accessors use {@link Optional#ofNullable(Object)};
 * prefer {@link #fold(Function, Function)} when {@code null} items are possible.
 *
 * @param <L> the left type
 * @param <R> the right type
 */
public interface Either<L, R> {

  /** @return true if this is a left */
  default boolean isLeft() {
    return fold(left -> true, right -> false);
  }

  /** @return true if this is a right */
  default boolean isRight() {
    return fold(left -> false, right -> true);
  }

  /**
   * Applies {@code leftFn} if this is a left, or {@code rightFn} if this is a right, and returns
   * the result.
   */
  <V> V fold(Function<? super L, ? extends V> leftFn, Function<? super R, ? extends V> rightFn);

  /** Runs {@code leftAction} or {@code rightAction} depending on the held alternative. */
  default void forEach(
      final Consumer<? super L> leftAction, final Consumer<? super R> rightAction) {
    fold(
        left -> {
          leftAction.accept(left);
          return null;
        },
        right -> {
          rightAction.accept(right);
          return null;
        });
  }

  /** Transforms the right alternative, leaving a left untouched. */
  default <V> Either<L, V> map(final Function<? super R, ? extends V> fn) {
    return fold(Either::left, right -> Either.right(fn.apply(right)));
  }

  /** Transforms the right alternative into a new Either, leaving a left untouched. */
  default <V> Either<L, V> flatMap(final Function<? super R, ? extends Either<L, V>> fn) {
    return fold(Either::left, fn);
  }

  default Optional<L> left() {
    return fold(Optional::ofNullable, right -> Optional.empty());
  }

  default Optional<R> right() {
    return fold(left -> Optional.empty(), Optional::ofNullable);
  }

  static <A, B> Either<A, B> left(final A a) {
    return new Either<A, B>() {
      @Override
      public <V> V fold(
          final Function<? super A, ? extends V> leftFn,
          final Function<? super B, ? extends V> rightFn) {
        return leftFn.apply(a);
      }

      @Override
      public String toString() {
        return "Left[" + a + "]";
      }
    };
  }

  static <A, B> Either<A, B> right(final B b) {
    return new Either<A, B>() {
      @Override
      public <V> V fold(
          final Function<? super A, ? extends V> leftFn,
          final Function<? super B, ? extends V> rightFn) {
        return rightFn.apply(b);
      }

      @Override
      public String toString() {
        return "Right[" + b + "]";
      }
    };
  }
}
