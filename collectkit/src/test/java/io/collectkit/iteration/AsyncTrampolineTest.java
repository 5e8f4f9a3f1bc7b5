/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.iteration;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.Test;

import io.collectkit.util.StageSupport;
import io.collectkit.util.TestUtil;

public class AsyncTrampolineTest {
  private static final ExecutorService EXEC_A = Executors.newSingleThreadExecutor();
  private static final ExecutorService EXEC_B = Executors.newSingleThreadExecutor();

  @AfterClass
  public static void shutdown() {
    EXEC_A.shutdown();
    EXEC_B.shutdown();
  }

  @Test
  public void testSynchronousStackUnroll() {
    final AtomicInteger sum = new AtomicInteger();
    final int breakPoint = 1_000_000; // enough to overflow the stack without trampolining

    final int last = TestUtil.join(AsyncTrampoline.asyncWhile(
        c -> c < breakPoint,
        c -> {
          sum.addAndGet(c);
          return StageSupport.completedStage(c + 1);
        },
        0));

    Assert.assertEquals(breakPoint, last);
    Assert.assertEquals(IntStream.range(0, breakPoint).sum(), sum.get());
  }

  @Test
  public void testThreadHops() throws Exception {
    final Thread threadA = CompletableFuture.supplyAsync(Thread::currentThread, EXEC_A).get();
    final Thread threadB = CompletableFuture.supplyAsync(Thread::currentThread, EXEC_B).get();

    final int result = CompletableFuture.supplyAsync(
        () -> AsyncTrampoline.asyncWhile(
            c -> c < 4,
            c -> {
              final CompletableFuture<Integer> future = new CompletableFuture<>();
              // alternate A -> B -> A so a frame is resumed on a thread that already ran the loop
              final ExecutorService next =
                  Thread.currentThread().equals(threadA) ? EXEC_B : EXEC_A;
              Assert.assertTrue(Thread.currentThread().equals(threadA)
                  || Thread.currentThread().equals(threadB));
              next.execute(() -> future.complete(c + 1));
              return future;
            },
            0),
        EXEC_A).get(10, TimeUnit.SECONDS).toCompletableFuture().get(10, TimeUnit.SECONDS);

    Assert.assertEquals(4, result);
  }

  @Test
  public void testDoWhileAppliesBodyFirst() {
    final AtomicInteger calls = new AtomicInteger();
    final int result = TestUtil.join(AsyncTrampoline.asyncDoWhile(
        c -> {
          calls.incrementAndGet();
          return StageSupport.completedStage(c + 1);
        },
        10,
        c -> c < 5));
    Assert.assertEquals(11, result);
    Assert.assertEquals(1, calls.get());
  }

  @Test
  public void testBooleanLoop() {
    final AtomicInteger count = new AtomicInteger();
    TestUtil.join(AsyncTrampoline.asyncWhile(
        () -> StageSupport.completedStage(count.incrementAndGet() < 100_000)));
    Assert.assertEquals(100_000, count.get());
  }

  @Test
  public void testNullIntermediateValue() {
    final Integer result = TestUtil.join(AsyncTrampoline.<Integer>asyncWhile(
        i -> i == null || i < 10,
        i -> StageSupport.completedStage(
            i == null ? Integer.valueOf(7) : (i == 3 ? null : i + 1)),
        0));
    Assert.assertEquals(10, result.intValue());
  }

  @Test
  public void testExceptionalBodyStopsLoop() {
    final AtomicInteger calls = new AtomicInteger();
    final Throwable ex = TestUtil.joinExceptionally(AsyncTrampoline.asyncWhile(
        c -> true,
        c -> calls.incrementAndGet() == 3
            ? StageSupport.<Integer>exceptionalStage(new IOException())
            : StageSupport.completedStage(c + 1),
        0));
    Assert.assertTrue(ex instanceof IOException);
    Assert.assertEquals(3, calls.get());
  }

  @Test(expected = NullPointerException.class)
  public void testNullBooleanThrowsException() throws Throwable {
    try {
      AsyncTrampoline.asyncWhile(() -> null).toCompletableFuture().join();
    } catch (final CompletionException e) {
      throw e.getCause();
    }
  }
}
