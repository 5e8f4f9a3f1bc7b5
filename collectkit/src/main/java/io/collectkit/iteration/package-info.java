/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Deferred, pull based pipelines. A {@link io.collectkit.iteration.LazySequence} is composed from
 * a source and intermediate stages, and driven by a terminal method; each pull is delivered via a
 * {@link java.util.concurrent.CompletionStage}, so any stage may suspend.
 */
package io.collectkit.iteration;
