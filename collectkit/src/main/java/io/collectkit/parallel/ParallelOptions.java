/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.parallel;

/**
 * Configuration of a {@link BoundedScheduler} run. Instances are immutable and built with
 * {@link #builder()}.
 *
 * <ul>
 * <li>{@code chunks}: the number of slices the input is partitioned into. Defaults to the number of
 * available processors, or 4 if the runtime reports none.
 * <li>{@code maxConcurrency}: the greatest number of handler invocations outstanding at once.
 * Defaults to {@code chunks}.
 * <li>{@code cancelOnFailure}: whether handler stages still outstanding when another one fails are
 * cancelled. Defaults to {@code true}.
 * </ul>
 */
public final class ParallelOptions {
  static final int FALLBACK_CHUNKS = 4;

  private final int chunks;
  private final int maxConcurrency;
  private final boolean cancelOnFailure;

  private ParallelOptions(final int chunks, final int maxConcurrency,
      final boolean cancelOnFailure) {
    this.chunks = chunks;
    this.maxConcurrency = maxConcurrency;
    this.cancelOnFailure = cancelOnFailure;
  }

  /** @return options with every value at its default */
  public static ParallelOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  static int defaultChunks() {
    final int processors = Runtime.getRuntime().availableProcessors();
    return processors > 0 ? processors : FALLBACK_CHUNKS;
  }

  public int getChunks() {
    return this.chunks;
  }

  public int getMaxConcurrency() {
    return this.maxConcurrency;
  }

  public boolean isCancelOnFailure() {
    return this.cancelOnFailure;
  }

  @Override
  public String toString() {
    return "ParallelOptions [chunks=" + this.chunks + ", maxConcurrency=" + this.maxConcurrency
        + ", cancelOnFailure=" + this.cancelOnFailure + "]";
  }

  /** Builder for {@link ParallelOptions}; unset values take their defaults on {@link #build()}. */
  public static final class Builder {
    private int chunks;
    private int maxConcurrency;
    private boolean cancelOnFailure = true;

    private Builder() {}

    /**
     * @throws IllegalArgumentException if {@code chunks} is not positive
     */
    public Builder chunks(final int chunks) {
      this.chunks = requirePositive("chunks", chunks);
      return this;
    }

    /**
     * @throws IllegalArgumentException if {@code maxConcurrency} is not positive
     */
    public Builder maxConcurrency(final int maxConcurrency) {
      this.maxConcurrency = requirePositive("maxConcurrency", maxConcurrency);
      return this;
    }

    public Builder cancelOnFailure(final boolean cancelOnFailure) {
      this.cancelOnFailure = cancelOnFailure;
      return this;
    }

    public ParallelOptions build() {
      final int c = this.chunks > 0 ? this.chunks : defaultChunks();
      final int m = this.maxConcurrency > 0 ? this.maxConcurrency : c;
      return new ParallelOptions(c, m, this.cancelOnFailure);
    }

    private static int requirePositive(final String name, final int value) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be positive, given " + value);
      }
      return value;
    }
  }
}
