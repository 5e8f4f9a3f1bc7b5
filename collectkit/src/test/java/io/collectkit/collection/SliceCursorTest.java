/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.collection;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Assert;
import org.junit.Test;

import io.collectkit.iteration.LazySequence;
import io.collectkit.util.TestUtil;

public class SliceCursorTest {

  @Test
  public void testSlicesInOrder() {
    final List<Collected<Integer>> slices =
        TestUtil.join(Collected.range(0, 9).cursor(3).toList());
    Assert.assertEquals(Arrays.asList(3, 3, 3, 1),
        slices.stream().map(Collected::size).collect(Collectors.toList()));
    Assert.assertEquals(Arrays.asList(
        Collected.of(0, 1, 2), Collected.of(3, 4, 5), Collected.of(6, 7, 8), Collected.of(9)),
        slices);
  }

  @Test
  public void testExactMultiple() {
    final List<Collected<Integer>> slices =
        TestUtil.join(Collected.range(1, 4).cursor(2).toList());
    Assert.assertEquals(Arrays.asList(Collected.of(1, 2), Collected.of(3, 4)), slices);
  }

  @Test
  public void testLargerThanSource() {
    Assert.assertEquals(Collections.singletonList(Collected.of(1, 2)),
        TestUtil.join(Collected.of(1, 2).cursor(10).toList()));
  }

  @Test
  public void testEmptySource() {
    Assert.assertEquals(Collections.emptyList(),
        TestUtil.join(Collected.<Integer>empty().cursor(3).toList()));
  }

  @Test
  public void testOnDemandPulls() {
    final LazySequence<Collected<Integer>> cursor = Collected.range(0, 9).cursor(4);
    Assert.assertEquals(Collected.of(0, 1, 2, 3), TestUtil.join(cursor.nextStage()).right().get());
    Assert.assertEquals(Collected.of(4, 5, 6, 7), TestUtil.join(cursor.nextStage()).right().get());
    Assert.assertEquals(Collected.of(8, 9), TestUtil.join(cursor.nextStage()).right().get());
    Assert.assertFalse(TestUtil.join(cursor.nextStage()).isRight());
    // stays terminal
    Assert.assertFalse(TestUtil.join(cursor.nextStage()).isRight());
  }

  @Test
  public void testCloseEndsCursor() {
    final LazySequence<Collected<Integer>> cursor = Collected.range(0, 9).cursor(2);
    Assert.assertTrue(TestUtil.join(cursor.nextStage()).isRight());
    TestUtil.join(cursor.close());
    Assert.assertFalse(TestUtil.join(cursor.nextStage()).isRight());
  }

  @Test
  public void testFeedsPipeline() {
    final List<Integer> sums = TestUtil.join(Collected.range(1, 10)
        .cursor(3)
        .map(slice -> slice.reduce(0, (acc, x) -> acc + x))
        .take(2)
        .toList());
    Assert.assertEquals(Arrays.asList(6, 15), sums);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroSize() {
    Collected.of(1).cursor(0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeSize() {
    Collected.of(1).cursor(-2);
  }
}
