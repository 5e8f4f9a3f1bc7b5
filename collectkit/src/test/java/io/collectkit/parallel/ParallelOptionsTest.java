/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.parallel;

import org.junit.Assert;
import org.junit.Test;

public class ParallelOptionsTest {

  @Test
  public void testDefaults() {
    final ParallelOptions options = ParallelOptions.defaults();
    Assert.assertEquals(Runtime.getRuntime().availableProcessors(), options.getChunks());
    Assert.assertEquals(options.getChunks(), options.getMaxConcurrency());
    Assert.assertTrue(options.isCancelOnFailure());
  }

  @Test
  public void testMaxConcurrencyFollowsChunks() {
    final ParallelOptions options = ParallelOptions.builder().chunks(6).build();
    Assert.assertEquals(6, options.getChunks());
    Assert.assertEquals(6, options.getMaxConcurrency());
  }

  @Test
  public void testExplicitValues() {
    final ParallelOptions options = ParallelOptions.builder()
        .chunks(8)
        .maxConcurrency(2)
        .cancelOnFailure(false)
        .build();
    Assert.assertEquals(8, options.getChunks());
    Assert.assertEquals(2, options.getMaxConcurrency());
    Assert.assertFalse(options.isCancelOnFailure());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroChunks() {
    ParallelOptions.builder().chunks(0);
  }

  @Test
  public void testNegativeConcurrency() {
    try {
      ParallelOptions.builder().maxConcurrency(-1);
      Assert.fail("expected IllegalArgumentException");
    } catch (final IllegalArgumentException e) {
      Assert.assertEquals("maxConcurrency must be positive, given -1", e.getMessage());
    }
  }
}
