/*
* Copyright (c) IBM Corporation 2017. All Rights Reserved.
* Project name: collectkit
* This project is licensed under the Apache License 2.0, see LICENSE.
*/

/**
 * Helpers for creating and combining {@link java.util.concurrent.CompletionStage
 * CompletionStages}.
 */
package io.collectkit.util;
