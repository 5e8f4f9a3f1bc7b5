/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.parallel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.collectkit.collection.Collected;
import io.collectkit.util.StageSupport;
import io.collectkit.util.TestUtil;

public class BoundedSchedulerTest {
  private ExecutorService pool;

  @Before
  public void setUp() {
    this.pool = Executors.newFixedThreadPool(8);
  }

  @After
  public void tearDown() throws InterruptedException {
    this.pool.shutdownNow();
    Assert.assertTrue(this.pool.awaitTermination(5, TimeUnit.SECONDS));
  }

  private static BoundedScheduler scheduler(final int chunks, final int maxConcurrency) {
    return new BoundedScheduler(
        ParallelOptions.builder().chunks(chunks).maxConcurrency(maxConcurrency).build());
  }

  private static List<Integer> flatten(final Collected<Collected<Integer>> slices) {
    return slices.flatMap(slice -> slice).items().stream().sorted().collect(Collectors.toList());
  }

  @Test
  public void testEverySliceHandledOnce() {
    final Collected<Collected<Integer>> result = TestUtil.join(
        scheduler(4, 2).run(Collected.range(0, 9), StageSupport::completedStage));
    Assert.assertEquals(Collected.range(0, 9).items(), flatten(result));
    Assert.assertEquals(Arrays.asList(1, 3, 3, 3),
        result.map(Collected::size).items().stream().sorted().collect(Collectors.toList()));
  }

  @Test
  public void testTransformedSlices() {
    final Collected<Integer> sums = TestUtil.join(scheduler(4, 2).run(Collected.range(0, 9),
        slice -> StageSupport.completedStage(slice.reduce(0, Integer::sum))));
    Assert.assertEquals(4, sums.size());
    Assert.assertEquals(45, sums.reduce(0, Integer::sum).intValue());
  }

  @Test
  public void testFewerItemsThanChunks() {
    final Collected<Collected<Integer>> result = TestUtil.join(
        scheduler(8, 8).run(Collected.of(1, 2, 3), StageSupport::completedStage));
    Assert.assertEquals(3, result.size());
    Assert.assertEquals(Arrays.asList(1, 2, 3), flatten(result));
  }

  @Test
  public void testEmptyInputSkipsHandler() {
    final AtomicInteger calls = new AtomicInteger();
    final Collected<Integer> result = TestUtil.join(scheduler(4, 2).run(Collected.<Integer>empty(),
        slice -> StageSupport.completedStage(calls.incrementAndGet())));
    Assert.assertTrue(result.isEmpty());
    Assert.assertEquals(0, calls.get());
  }

  @Test
  public void testResultsInCompletionOrder() {
    final List<CompletableFuture<String>> started = Collections.synchronizedList(new ArrayList<>());
    final CompletionStage<Collected<String>> result =
        scheduler(4, 2).run(Collected.range(1, 8), slice -> {
          final CompletableFuture<String> f = new CompletableFuture<>();
          started.add(f);
          return f;
        });

    Assert.assertEquals(2, started.size());
    started.get(1).complete("b");
    // the freed permit admits the third slice
    Assert.assertEquals(3, started.size());
    started.get(0).complete("a");
    Assert.assertEquals(4, started.size());
    started.get(3).complete("d");
    Assert.assertFalse(result.toCompletableFuture().isDone());
    started.get(2).complete("c");

    Assert.assertEquals(Collected.of("b", "a", "d", "c"), TestUtil.join(result));
  }

  @Test
  public void testOutstandingNeverExceedsLimit() throws Exception {
    final int maxConcurrency = 3;
    final ConcurrencyLedger ledger = new ConcurrencyLedger(maxConcurrency);
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();

    final CompletionStage<Collected<Integer>> result = scheduler(16, maxConcurrency).run(
        Collected.range(1, 160),
        slice -> {
          peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
          return CompletableFuture.supplyAsync(() -> {
            try {
              Thread.sleep(2);
            } catch (final InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
            return slice.size();
          }, this.pool);
        },
        ledger);

    final Collected<Integer> sizes = TestUtil.join(result, 10, TimeUnit.SECONDS);
    Assert.assertEquals(16, sizes.size());
    Assert.assertEquals(160, sizes.reduce(0, Integer::sum).intValue());
    Assert.assertTrue("peak " + peak.get(), peak.get() <= maxConcurrency);
    Assert.assertTrue(ledger.getHighWaterMark() <= maxConcurrency);
    Assert.assertEquals(0, ledger.size());
  }

  @Test
  public void testManySynchronousSlices() {
    final Collected<Integer> result = TestUtil.join(scheduler(20_000, 1)
        .run(Collected.range(1, 20_000), slice -> StageSupport.completedStage(slice.get(0))));
    Assert.assertEquals(20_000, result.size());
  }

  @Test
  public void testSynchronousThrowFailsRun() {
    final List<CompletableFuture<Integer>> started = new ArrayList<>();
    final AtomicInteger calls = new AtomicInteger();
    final IllegalStateException boom = new IllegalStateException("boom");
    final CompletionStage<Collected<Integer>> result =
        scheduler(4, 4).run(Collected.range(0, 9), slice -> {
          if (calls.getAndIncrement() == 1) {
            throw boom;
          }
          final CompletableFuture<Integer> f = new CompletableFuture<>();
          started.add(f);
          return f;
        });

    final Throwable ex = TestUtil.joinExceptionally(result);
    Assert.assertTrue(ex instanceof SchedulerException);
    Assert.assertEquals(1, ((SchedulerException) ex).getSliceIndex());
    Assert.assertSame(boom, ex.getCause());
    // nothing is admitted after the failure
    Assert.assertEquals(2, calls.get());
    Assert.assertEquals(1, started.size());
    Assert.assertTrue(started.get(0).isCancelled());
  }

  @Test
  public void testExceptionalStageFailsRun() {
    final AtomicInteger calls = new AtomicInteger();
    final IOException ioe = new IOException();
    final CompletionStage<Collected<Integer>> result =
        scheduler(4, 1).run(Collected.range(0, 9), slice -> calls.getAndIncrement() == 2
            ? StageSupport.<Integer>exceptionalStage(ioe)
            : StageSupport.completedStage(slice.size()));

    final SchedulerException ex = (SchedulerException) TestUtil.joinExceptionally(result);
    Assert.assertEquals(2, ex.getSliceIndex());
    Assert.assertSame(ioe, ex.getCause());
    Assert.assertEquals(3, calls.get());
  }

  @Test
  public void testNullStageFailsRun() {
    final Throwable ex = TestUtil.joinExceptionally(
        scheduler(2, 2).run(Collected.range(0, 3), slice -> null));
    Assert.assertTrue(ex instanceof SchedulerException);
    Assert.assertTrue(ex.getCause() instanceof NullPointerException);
  }

  @Test
  public void testOutstandingRunOnWithoutCancellation() {
    final List<CompletableFuture<Integer>> started = new ArrayList<>();
    final BoundedScheduler scheduler = new BoundedScheduler(ParallelOptions.builder()
        .chunks(3)
        .maxConcurrency(3)
        .cancelOnFailure(false)
        .build());
    final CompletionStage<Collected<Integer>> result =
        scheduler.run(Collected.range(0, 2), slice -> {
          final CompletableFuture<Integer> f = new CompletableFuture<>();
          started.add(f);
          return f;
        });

    Assert.assertEquals(3, started.size());
    started.get(1).completeExceptionally(new IOException());
    Assert.assertTrue(TestUtil.joinExceptionally(result) instanceof SchedulerException);
    Assert.assertFalse(started.get(0).isCancelled());
    Assert.assertFalse(started.get(2).isCancelled());

    // late results are discarded
    started.get(0).complete(1);
    started.get(2).complete(3);
    Assert.assertEquals(1, ((SchedulerException) TestUtil.joinExceptionally(result))
        .getSliceIndex());
  }

  @Test
  public void testSliceAdmittedDuringFailureNeverRuns() {
    final CompletableFuture<Integer> firstSlice = new CompletableFuture<>();
    final AtomicInteger calls = new AtomicInteger();
    // slice 0 fails while slice 1 is being registered, after its admission check passed
    final ConcurrencyLedger ledger = new ConcurrencyLedger(2) {
      @Override
      public synchronized void register(final CompletableFuture<?> handle) {
        super.register(handle);
        if (size() == 2) {
          firstSlice.completeExceptionally(new IOException());
        }
      }
    };
    final BoundedScheduler scheduler = new BoundedScheduler(ParallelOptions.builder()
        .chunks(3)
        .maxConcurrency(2)
        .cancelOnFailure(false)
        .build());
    final CompletionStage<Collected<Integer>> result =
        scheduler.run(Collected.range(0, 5), slice -> {
          calls.incrementAndGet();
          return firstSlice;
        }, ledger);

    final SchedulerException ex = (SchedulerException) TestUtil.joinExceptionally(result);
    Assert.assertEquals(0, ex.getSliceIndex());
    Assert.assertEquals(1, calls.get());
    Assert.assertEquals(0, ledger.size());
  }

  @Test
  public void testCollectedEntryPoint() {
    final Collected<Integer> sizes = TestUtil.join(Collected.range(1, 12).parallel(
        slice -> CompletableFuture.supplyAsync(slice::size, this.pool),
        ParallelOptions.builder().chunks(3).maxConcurrency(2).build()));
    Assert.assertEquals(Arrays.asList(4, 4, 4), sizes.items());
  }

  @Test
  public void testSchedulerIsReusable() {
    final BoundedScheduler scheduler = scheduler(2, 1);
    for (int i = 0; i < 3; i++) {
      Assert.assertEquals(2, TestUtil.join(scheduler.run(Collected.range(0, 5),
          slice -> StageSupport.completedStage(slice.size()))).size());
    }
  }
}
