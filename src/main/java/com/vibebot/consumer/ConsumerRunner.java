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
package com.vibebot.consumer;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link BotConsumer} to completion in the calling thread.
 *
 * <p>This is the entry point to give to a thread or an executor: {@link #run()} starts the
 * consumer and returns once it is closed, {@link #requestStop()} asks it to stop from another
 * thread.
 *
 * <pre>{@code
 * ConsumerRunner runner = new ConsumerRunner(consumer);
 * Thread thread = new Thread(runner, "bot-consumer-0");
 * thread.start();
 * ...
 * runner.requestStop();
 * }</pre>
 */
public final class ConsumerRunner implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerRunner.class);
  private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

  private final BotConsumer consumer;
  private final FailureSignal failureSignal;
  private final CountDownLatch done = new CountDownLatch(1);
  private volatile boolean stopRequested = false;

  public ConsumerRunner(BotConsumer consumer) {
    this(consumer, FailureSignal.NO_OP);
  }

  /**
   * Constructor with a failure signal used if the consumer cannot even be started.
   *
   * <p>Failures of a running consumer are reported by the failure signal of the consumer itself.
   *
   * @param consumer the consumer to run
   * @param failureSignal signal for start-up failures
   */
  public ConsumerRunner(BotConsumer consumer, FailureSignal failureSignal) {
    this.consumer = consumer;
    this.failureSignal = failureSignal;
  }

  @Override
  public void run() {
    ConsumerIdentity identity = this.consumer.identity();
    String threadName = Thread.currentThread().getName();
    try {
      LOGGER.info(
          "Starting consumer {} of bot '{}' in thread {}",
          identity.consumerIndex(),
          identity.botId(),
          threadName);
      this.consumer.start();
      boolean terminated = false;
      while (!terminated) {
        if (this.stopRequested || Thread.currentThread().isInterrupted()) {
          LOGGER.info("Stopping consumer {} in thread {}", identity.consumerIndex(), threadName);
          boolean interrupted = Thread.interrupted();
          this.consumer.stop();
          if (interrupted) {
            Thread.currentThread().interrupt();
          }
          terminated = true;
        } else {
          terminated = this.consumer.awaitTermination(POLL_INTERVAL);
        }
      }
      LOGGER.info(
          "Consumer {} of bot '{}' ended in state {}",
          identity.consumerIndex(),
          identity.botId(),
          this.consumer.state());
    } catch (Exception e) {
      LOGGER.warn(
          "Exception caught on consumer {} in thread {}", identity.consumerIndex(), threadName, e);
      this.failureSignal.signal(identity, e);
    } finally {
      this.done.countDown();
    }
  }

  /** Ask the consumer to stop, without waiting. */
  public void requestStop() {
    this.stopRequested = true;
  }

  /**
   * Wait for {@link #run()} to return.
   *
   * @param timeout maximum time to wait
   * @return true if the runner completed, false if the timeout elapsed
   */
  public boolean join(Duration timeout) {
    try {
      return this.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public BotConsumer consumer() {
    return this.consumer;
  }
}
