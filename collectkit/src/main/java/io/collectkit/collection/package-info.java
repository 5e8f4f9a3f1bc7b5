/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * The realized collection {@link io.collectkit.collection.Collected} and its eager operators. It is
 * the source of deferred pipelines, slice cursors and bounded-concurrency runs.
 */
package io.collectkit.collection;
