/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

package io.collectkit.parallel;

/**
 * Completes the result of a {@link BoundedScheduler} run whose handler failed on one of the
 * slices. The handler's failure is the {@link #getCause() cause}.
 */
public class SchedulerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int sliceIndex;

  public SchedulerException(final int sliceIndex, final Throwable cause) {
    super("handler failed on slice " + sliceIndex, cause);
    this.sliceIndex = sliceIndex;
  }

  /** @return the 0-based position, in partition order, of the slice whose handler failed */
  public int getSliceIndex() {
    return this.sliceIndex;
  }
}
