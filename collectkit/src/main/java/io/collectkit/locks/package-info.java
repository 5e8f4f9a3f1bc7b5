/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Asynchronous synchronization primitives that complete {@link java.util.concurrent.CompletionStage
 * stages} instead of blocking threads.
 */
package io.collectkit.locks;
