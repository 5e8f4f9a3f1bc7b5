/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.util;

import java.util.concurrent.CompletionStage;

/**
 * An object that may hold resources, or upstream producers, that should be released once it is no
 * longer used. Unlike {@link AutoCloseable}, release may complete asynchronously.
 */
@FunctionalInterface
public interface AsyncCloseable {

  /**
   * Relinquishes any resources associated with this object. Implementations must tolerate repeated
   * calls.
   *
   * @return a {@link CompletionStage} that completes when the resources have been released
   */
  CompletionStage<Void> close();
}
