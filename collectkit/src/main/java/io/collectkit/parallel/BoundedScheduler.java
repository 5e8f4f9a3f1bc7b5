/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.parallel;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import io.collectkit.collection.Collected;
import io.collectkit.iteration.AsyncTrampoline;
import io.collectkit.locks.AsyncSemaphore;
import io.collectkit.locks.FifoAsyncSemaphore;
import io.collectkit.util.StageSupport;

/**
 * Runs an asynchronous handler over the partitions of a {@link Collected}, with a cap on how many
 * handler invocations are outstanding at once.
 *
 * <p>
 * The input of length {@code L} is split into {@code chunks} contiguous slices of
 * {@code ceil(L / chunks)} items, the last one possibly shorter. Slices are submitted in partition
 * order; when {@code maxConcurrency} invocations are outstanding, the next submission waits until
 * the first of them settles, whichever that is. The result holds one handler result per slice in
 * <b>completion order</b>, not partition order.
 *
 * <p>
 * If an invocation fails, by throwing or by completing its stage exceptionally, the result
 * completes with a {@link SchedulerException} at once and no further slices are submitted. Stages
 * still outstanding are cancelled when {@link ParallelOptions#isCancelOnFailure()} is set;
 * otherwise they run to completion. Their results are discarded either way.
 *
 * <pre>
 * {@code
 * BoundedScheduler scheduler =
 *     new BoundedScheduler(ParallelOptions.builder().chunks(4).maxConcurrency(2).build());
 * CompletionStage<Collected<Integer>> sizes =
 *     scheduler.run(Collected.range(0, 9), slice -> store.writeAsync(slice));
 * }
 * </pre>
 *
 * A scheduler holds no state between runs and may be shared.
 */
public final class BoundedScheduler {
  private static final Logger LOGGER = LogManager.getLogger(BoundedScheduler.class);

  private final ParallelOptions options;

  public BoundedScheduler(final ParallelOptions options) {
    this.options = Objects.requireNonNull(options);
  }

  public ParallelOptions getOptions() {
    return this.options;
  }

  /**
   * Partitions {@code items} and runs {@code handler} over every slice.
   *
   * @param items the realized input
   * @param handler produces a stage of the result for one slice
   * @return a stage of the slice results in completion order, or completed exceptionally with a
   *         {@link SchedulerException}
   */
  public <T, U> CompletionStage<Collected<U>> run(
      final Collected<T> items,
      final Function<? super Collected<T>, ? extends CompletionStage<U>> handler) {
    return run(items, handler, new ConcurrencyLedger(this.options.getMaxConcurrency()));
  }

  <T, U> CompletionStage<Collected<U>> run(
      final Collected<T> items,
      final Function<? super Collected<T>, ? extends CompletionStage<U>> handler,
      final ConcurrencyLedger ledger) {
    Objects.requireNonNull(items);
    Objects.requireNonNull(handler);
    if (items.isEmpty()) {
      return StageSupport.completedStage(Collected.empty());
    }
    final int chunks = this.options.getChunks();
    final int chunkSize = (int) ((items.size() + (long) chunks - 1) / chunks);
    final Collected<Collected<T>> slices = items.chunk(chunkSize);
    LOGGER.debug("Running handler over {} slices of up to {} items, at most {} at a time",
        slices.size(), chunkSize, this.options.getMaxConcurrency());
    return new Run<>(slices, handler, ledger).start();
  }

  @Override
  public String toString() {
    return "BoundedScheduler [" + this.options + "]";
  }

  /** State of one invocation of {@link #run} */
  private final class Run<T, U> {
    private final Iterator<Collected<T>> slices;
    private final Function<? super Collected<T>, ? extends CompletionStage<U>> handler;
    private final ConcurrencyLedger ledger;
    private final AsyncSemaphore permits;
    private final CompletableFuture<Collected<U>> result = new CompletableFuture<>();
    private final AtomicBoolean failed = new AtomicBoolean();

    // guarded by this
    private final List<U> completed = new ArrayList<>();
    private boolean submitting = true;

    private int nextIndex;

    Run(final Collected<Collected<T>> slices,
        final Function<? super Collected<T>, ? extends CompletionStage<U>> handler,
        final ConcurrencyLedger ledger) {
      this.slices = slices.iterator();
      this.handler = handler;
      this.ledger = ledger;
      this.permits = new FifoAsyncSemaphore(ledger.getCapacity());
    }

    CompletionStage<Collected<U>> start() {
      AsyncTrampoline.asyncWhile(this::submitNext).whenComplete((ig, ex) -> {
        if (ex != null) {
          this.result.completeExceptionally(StageSupport.unwrap(ex));
          return;
        }
        synchronized (this) {
          this.submitting = false;
        }
        finishIfDone();
      });
      return this.result;
    }

    private CompletionStage<Boolean> submitNext() {
      if (this.failed.get() || !this.slices.hasNext()) {
        return StageSupport.completedStage(false);
      }
      return this.permits.acquire().thenApply(ig -> {
        if (this.failed.get()) {
          this.permits.release();
          return false;
        }
        submit(this.nextIndex++, this.slices.next());
        return true;
      });
    }

    private void submit(final int index, final Collected<T> slice) {
      final CompletableFuture<U> handle = new CompletableFuture<>();
      this.ledger.register(handle);
      handle.whenComplete((u, ex) -> settle(index, handle, u, ex));
      if (this.failed.get()) {
        // a failure landed between admission and registration; settling the cancelled handle
        // returns its permit
        LOGGER.trace("Dropping slice {}, a previous slice failed", index);
        handle.cancel(true);
        return;
      }
      LOGGER.trace("Submitting slice {} of {} items, {} outstanding", index, slice.size(),
          this.ledger.size());

      final CompletionStage<U> task = StageSupport.convertSynchronousException(
          () -> Objects.requireNonNull(this.handler.apply(slice), "handler returned null"));
      task.whenComplete((u, ex) -> {
        if (ex == null) {
          handle.complete(u);
        } else {
          handle.completeExceptionally(ex);
        }
      });
      if (task instanceof Future) {
        handle.whenComplete((u, ex) -> {
          if (handle.isCancelled()) {
            ((Future<?>) task).cancel(true);
          }
        });
      }
    }

    private void settle(final int index, final CompletableFuture<U> handle, final U u,
        final Throwable ex) {
      if (ex == null) {
        synchronized (this) {
          if (!this.failed.get()) {
            this.completed.add(u);
          }
        }
      } else {
        fail(index, ex);
      }
      this.ledger.remove(handle);
      LOGGER.trace("Slice {} settled", index);
      this.permits.release();
      finishIfDone();
    }

    private void fail(final int index, final Throwable ex) {
      if (!this.failed.compareAndSet(false, true)) {
        return;
      }
      final Throwable cause = StageSupport.unwrap(ex);
      LOGGER.debug("Handler failed on slice {}, stopping submission", index, cause);
      this.result.completeExceptionally(new SchedulerException(index, cause));
      if (BoundedScheduler.this.options.isCancelOnFailure()) {
        final List<CompletableFuture<?>> outstanding = this.ledger.snapshot();
        LOGGER.debug("Cancelling {} outstanding slices", outstanding.size());
        for (final CompletableFuture<?> handle : outstanding) {
          handle.cancel(true);
        }
      }
    }

    private void finishIfDone() {
      final List<U> snapshot;
      synchronized (this) {
        if (this.submitting || this.ledger.size() > 0 || this.failed.get()) {
          return;
        }
        snapshot = new ArrayList<>(this.completed);
      }
      if (this.result.complete(Collected.collect(snapshot))) {
        LOGGER.debug("All {} slices settled", snapshot.size());
      }
    }
  }
}
