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

/**
 * Consumer bound to an exchange through a durable queue.
 *
 * <p>Each received message is acknowledged, decoded and passed to a {@link MessageHandler}. The
 * messages the handler returns are published, a message that cannot be decoded or processed is
 * sent as-is to the error queue of the consumer.
 *
 * <p>The consumer reconnects automatically when the connection is lost or closed by the broker.
 * It goes through the states of {@link Resource.State} and ends in {@link Resource.State#CLOSED},
 * after {@link #stop()} or after a fatal error. A closed consumer cannot be restarted.
 *
 * <p>Instances are configured and created with a {@link BotConsumerBuilder}.
 *
 * @see com.vibebot.consumer.impl.AmqpBotConsumerBuilder
 */
public interface BotConsumer extends AutoCloseable, Resource {

  /**
   * Start connecting to the broker.
   *
   * <p>The method returns immediately, the consumer sets up the topology and starts consuming in
   * the background.
   *
   * @throws ConsumerException.ConsumerInvalidStateException if the consumer has already been
   *     started
   */
  void start();

  /**
   * Cancel the subscription and close the connection.
   *
   * <p>The method waits for the broker to acknowledge the cancellation and for the connection to
   * be closed. A message being processed is processed completely before the consumer closes.
   *
   * <p>Calling the method several times is safe, the subsequent calls wait for the same
   * termination.
   */
  void stop();

  /**
   * Wait for the consumer to reach the {@link Resource.State#CLOSED} state.
   *
   * @param timeout maximum time to wait
   * @return true if the consumer is closed, false if the timeout elapsed
   */
  boolean awaitTermination(Duration timeout);

  /**
   * Current state.
   *
   * @return the state
   */
  State state();

  /**
   * Identity of the consumer.
   *
   * @return the identity
   */
  ConsumerIdentity identity();

  /**
   * The failure that closed the consumer, if any.
   *
   * @return the failure cause, null if the consumer is running or has been stopped normally
   */
  Throwable failureCause();

  /** Same as {@link #stop()}. */
  @Override
  void close();
}
