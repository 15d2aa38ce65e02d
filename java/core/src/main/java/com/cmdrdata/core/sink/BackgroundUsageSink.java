/*
 * Copyright 2025 CmdrData
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cmdrdata.core.sink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cmdrdata.core.UsageEvent;
import com.cmdrdata.core.UsageSink;

/**
 * BackgroundUsageSink moves delivery off the calling thread.
 *
 * <p>
 * Events are handed to an executor, a single daemon thread by default, and
 * forwarded to the delegate there. Delivery failures are logged and dropped.
 * Events recorded after {@link #close()} are dropped with a warning.
 */
public class BackgroundUsageSink implements UsageSink, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(BackgroundUsageSink.class);
  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final UsageSink delegate;
  private final ExecutorService executor;
  private final Duration shutdownTimeout;

  /**
   * Creates a BackgroundUsageSink with its own daemon thread.
   *
   * @param delegate
   *            the sink doing the actual delivery
   */
  public BackgroundUsageSink(UsageSink delegate) {
    this(delegate, Executors.newSingleThreadExecutor(r -> {
      Thread thread = new Thread(r, "cmdrdata-usage-sink");
      thread.setDaemon(true);
      return thread;
    }), DEFAULT_SHUTDOWN_TIMEOUT);
  }

  /**
   * Creates a BackgroundUsageSink on the given executor.
   *
   * @param delegate
   *            the sink doing the actual delivery
   * @param executor
   *            the executor; it is shut down by {@link #close()}
   * @param shutdownTimeout
   *            how long {@link #close()} waits for pending events
   */
  public BackgroundUsageSink(UsageSink delegate, ExecutorService executor, Duration shutdownTimeout) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
  }

  @Override
  public void recordUsage(UsageEvent event) {
    try {
      executor.execute(() -> deliver(event));
    } catch (RejectedExecutionException e) {
      logger.warn("Dropping usage event {}: sink is closed", event.getRequestId());
    }
  }

  private void deliver(UsageEvent event) {
    try {
      delegate.recordUsage(event);
    } catch (Exception e) {
      logger.warn("Failed to deliver usage event {}: {}", event.getRequestId(), e.getMessage());
      logger.debug("Delivery failure", e);
    }
  }

  /**
   * Stops accepting events and waits for pending ones to be delivered.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Usage sink did not drain within {}; dropping pending events", shutdownTimeout);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    if (delegate instanceof AutoCloseable) {
      closeQuietly((AutoCloseable) delegate);
    }
  }

  static void closeQuietly(AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (Exception e) {
      logger.warn("Failed to close usage sink {}: {}", closeable, e.getMessage());
    }
  }
}
