// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.vibebot.consumer.impl;

import com.vibebot.consumer.ConsumerException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded loop executing the tasks of one consumer, in submission order.
 *
 * <p>Tasks submitted after the loop is closed are dropped. Any {@link Throwable} escaping a task,
 * {@link Error} included, is passed to the error handler.
 */
final class EventLoop implements Executor, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventLoop.class);

  private final String name;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final ExecutorService executorService;
  private final ScheduledExecutorService scheduledExecutorService;
  private final Future<?> loop;
  private final AtomicReference<Thread> loopThread = new AtomicReference<>();
  private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();

  EventLoop(String name, Consumer<Throwable> errorHandler) {
    this.name = name;
    this.executorService = Utils.singleThreadExecutorService("%s-", name);
    this.scheduledExecutorService = Utils.scheduledExecutorService("%s-scheduler-", name);
    CountDownLatch loopThreadSetLatch = new CountDownLatch(1);
    this.loop =
        this.executorService.submit(
            () -> {
              loopThread.set(Thread.currentThread());
              loopThreadSetLatch.countDown();
              while (!Thread.currentThread().isInterrupted()) {
                try {
                  Runnable task = this.taskQueue.poll(1000, TimeUnit.MILLISECONDS);
                  if (task != null) {
                    task.run();
                  }
                } catch (InterruptedException e) {
                  LOGGER.debug("Event loop '{}' has been interrupted.", this.name);
                  return;
                } catch (Throwable e) {
                  // errors included, the loop thread must keep polling or hand over to close()
                  LOGGER.warn("Error during processing of task in event loop '{}'", this.name, e);
                  try {
                    errorHandler.accept(e);
                  } catch (Throwable ex) {
                    LOGGER.warn("Error in error handler of event loop '{}'", this.name, ex);
                  }
                }
              }
            });
    try {
      if (!loopThreadSetLatch.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("Event loop could not start");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConsumerException("Error while creating event loop", e);
    }
  }

  @Override
  public void execute(Runnable task) {
    if (this.closed.get()) {
      LOGGER.debug("Event loop '{}' is closed, dropping task", this.name);
    } else {
      this.taskQueue.add(task);
    }
  }

  /**
   * Execute a task in the loop after a delay.
   *
   * @param delay the delay
   * @param task the task
   * @return a future to cancel the task
   */
  ScheduledFuture<?> schedule(Duration delay, Runnable task) {
    if (this.closed.get()) {
      throw new IllegalStateException("Event loop is closed");
    }
    return this.scheduledExecutorService.schedule(
        () -> this.execute(task), delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  boolean inLoop() {
    return Thread.currentThread().equals(this.loopThread.get());
  }

  boolean isClosed() {
    return this.closed.get();
  }

  /**
   * Stop the loop.
   *
   * <p>When called from a task, the loop stops once the task returns.
   */
  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      this.loop.cancel(true);
      this.executorService.shutdownNow();
      this.scheduledExecutorService.shutdownNow();
      this.taskQueue.clear();
    }
  }
}
