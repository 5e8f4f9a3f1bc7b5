/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.iteration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.Assert;
import org.junit.Test;
import org.junit.experimental.runners.Enclosed;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import io.collectkit.util.Either;
import io.collectkit.util.StageSupport;
import io.collectkit.util.TestUtil;

@RunWith(Enclosed.class)
public class LazySequenceParameterizedTest {
  private static class TestException extends RuntimeException {
    private static final long serialVersionUID = 1L;
  }

  static final TestException testException = new TestException();

  private static <T, R> Function<T, R> named(final String name, final Function<T, R> fn) {
    return new Function<T, R>() {
      @Override
      public R apply(final T t) {
        return fn.apply(t);
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  static final List<Function<LazySequence<Integer>, LazySequence<?>>> intermediateMethods =
      Arrays.asList(
          named("map", seq -> seq.map(i -> i + 1)),
          named("mapAsync", seq -> seq.mapAsync(i -> StageSupport.completedStage(i + 1))),
          named("filter", seq -> seq.filter(i -> true)),
          named("filterAsync", seq -> seq.filterAsync(i -> StageSupport.completedStage(true))),
          named("flatMap", seq -> seq.flatMap(i -> Arrays.asList(i, i))),
          named("take", seq -> seq.take(100)),
          named("skip", seq -> seq.skip(1)),
          named("takeWhile", seq -> seq.takeWhile(i -> true)),
          named("skipWhile", seq -> seq.skipWhile(i -> i < 1)),
          named("chunk", seq -> seq.chunk(2)),
          named("fuse", LazySequence::fuse));

  // every terminal method here pulls until the sequence ends
  static final List<Function<LazySequence<?>, CompletionStage<?>>> terminalMethods =
      Arrays.asList(
          named("toList", LazySequence::toList),
          named("forEach", seq -> seq.forEach(i -> {
          })),
          named("consume", LazySequence::consume),
          named("collect", seq -> seq.collect(Collectors.toList())),
          named("collect2", seq -> seq.collect(ArrayList<Object>::new, List::add)),
          named("reduce", seq -> seq.reduce(new Object(), (acc, i) -> acc)),
          named("count", LazySequence::count),
          named("findFirst", seq -> seq.findFirst(i -> false)));

  /** yields 0, 1, 2 and then fails every pull */
  static class FailingSequence implements LazySequence<Integer> {
    int next = 0;
    boolean closed = false;

    @Override
    public CompletionStage<Either<End, Integer>> nextStage() {
      if (this.next < 3) {
        return StageSupport.completedStage(Either.right(this.next++));
      }
      return StageSupport.exceptionalStage(testException);
    }

    @Override
    public CompletionStage<Void> close() {
      this.closed = true;
      return StageSupport.voidStage();
    }
  }

  @RunWith(Parameterized.class)
  public static class ExceptionPropagationTest {
    @Parameterized.Parameter(0)
    public Function<LazySequence<Integer>, LazySequence<?>> intermediate;

    @Parameterized.Parameter(1)
    public Function<LazySequence<?>, CompletionStage<?>> terminal;

    @Parameterized.Parameters(name = "{index} intermediate: {0}, terminal: {1}")
    public static Collection<Object[]> data() {
      final List<Object[]> list = new ArrayList<>();
      for (final Function<LazySequence<Integer>, LazySequence<?>> i : intermediateMethods) {
        for (final Function<LazySequence<?>, CompletionStage<?>> t : terminalMethods) {
          list.add(new Object[] {i, t});
        }
      }
      return list;
    }

    @Test
    public void testUpstreamFailureReachesTerminal() {
      final CompletionStage<?> result =
          this.terminal.apply(this.intermediate.apply(new FailingSequence()));
      Assert.assertSame(testException, TestUtil.joinExceptionally(result));
    }

    @Test
    public void testSynchronousThrowReachesTerminal() {
      final LazySequence<Integer> throwing = () -> {
        throw testException;
      };
      final CompletionStage<?> result = this.terminal.apply(this.intermediate.apply(throwing));
      Assert.assertSame(testException, TestUtil.joinExceptionally(result));
    }
  }

  @RunWith(Parameterized.class)
  public static class ClosePropagationTest {
    @Parameterized.Parameter
    public Function<LazySequence<Integer>, LazySequence<?>> intermediate;

    @Parameterized.Parameters(name = "{index} intermediate: {0}")
    public static Collection<Object[]> data() {
      return intermediateMethods.stream()
          .map(i -> new Object[] {i})
          .collect(Collectors.toList());
    }

    @Test
    public void testCloseReachesSource() {
      final FailingSequence source = new FailingSequence();
      final LazySequence<?> seq = this.intermediate.apply(source);
      TestUtil.join(seq.close());
      Assert.assertTrue(source.closed);
    }

    @Test
    public void testCloseAfterPartialConsumption() {
      final FailingSequence source = new FailingSequence();
      final LazySequence<?> seq = this.intermediate.apply(source);
      Assert.assertTrue(TestUtil.join(seq.nextStage()).isRight());
      Assert.assertFalse(source.closed);
      TestUtil.join(seq.close());
      Assert.assertTrue(source.closed);
    }

    @Test
    public void testStagesAreIndependentOfEachOther() {
      // composing a stage has no side effect on its source
      final FailingSequence source = new FailingSequence();
      this.intermediate.apply(source);
      Assert.assertEquals(0, source.next);
      Assert.assertFalse(source.closed);
    }
  }
}
