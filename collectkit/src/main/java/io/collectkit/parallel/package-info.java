/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Bounded-concurrency execution of an asynchronous handler over the partitions of a
 * {@link io.collectkit.collection.Collected}.
 *
 * @see io.collectkit.parallel.BoundedScheduler
 */
package io.collectkit.parallel;
