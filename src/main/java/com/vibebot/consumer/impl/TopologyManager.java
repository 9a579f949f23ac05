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
import com.vibebot.consumer.ConsumerIdentity;
import com.vibebot.consumer.TransportChannel;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the topology of a consumer.
 *
 * <p>The exchange is checked passively, it must exist. The work queue and the error queue are
 * durable and non-exclusive, and the work queue is bound to the exchange with an empty routing
 * key. The declarations are idempotent.
 */
final class TopologyManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(TopologyManager.class);

  static final String BINDING_KEY = "";

  private final ConsumerIdentity identity;
  private final Executor executor;

  TopologyManager(ConsumerIdentity identity, Executor executor) {
    this.identity = identity;
    this.executor = executor;
  }

  /**
   * Declare the topology on the channel.
   *
   * <p>A failed step stops the chain. The returned future then fails with a {@link
   * ConsumerException.TopologyException}, or with a {@link ConsumerException.ConnectionException}
   * if the connection went away.
   *
   * @param channel the channel to use
   * @return a future completed when all the declarations are done
   */
  CompletableFuture<Void> declare(TransportChannel channel) {
    String botId = this.identity.botId();
    String exchange = this.identity.exchange();
    String queue = this.identity.queueName();
    String errorQueue = this.identity.errorQueueName();
    LOGGER.info("[{}] Checking exchange {} exists", botId, exchange);
    return step(
            () -> channel.declareExchangePassive(exchange),
            "check exchange '%s' exists",
            exchange)
        .thenComposeAsync(
            ignored -> {
              LOGGER.info("Declaring queue {}", queue);
              return step(
                  () -> channel.declareQueue(queue, true, false), "declare queue '%s'", queue);
            },
            this.executor)
        .thenComposeAsync(
            ignored -> {
              LOGGER.info(
                  "[{}] Binding to {} with queue {} and routing key \"{}\"",
                  botId,
                  exchange,
                  queue,
                  BINDING_KEY);
              return step(
                  () -> channel.bindQueue(queue, exchange, BINDING_KEY),
                  "bind queue '%s' to exchange '%s'",
                  queue,
                  exchange);
            },
            this.executor)
        .thenComposeAsync(
            ignored -> {
              LOGGER.info("Queue bound");
              LOGGER.info("Declaring error queue {}", errorQueue);
              return step(
                  () -> channel.declareQueue(errorQueue, true, false),
                  "declare error queue '%s'",
                  errorQueue);
            },
            this.executor)
        .thenRunAsync(
            () -> LOGGER.info("[{}] error queue created: {}", botId, errorQueue), this.executor);
  }

  private static CompletableFuture<Void> step(
      Supplier<CompletableFuture<Void>> operation, String descriptionFormat, Object... args) {
    CompletableFuture<Void> operationResult;
    try {
      operationResult = operation.get();
    } catch (Exception e) {
      operationResult = CompletableFuture.failedFuture(e);
    }
    CompletableFuture<Void> result = new CompletableFuture<>();
    operationResult.whenComplete(
        (ignored, ex) -> {
          if (ex == null) {
            result.complete(null);
          } else {
            Throwable cause = ExceptionUtils.unwrap(ex);
            if (cause instanceof ConsumerException.ConnectionException) {
              result.completeExceptionally(cause);
            } else {
              String description = String.format(descriptionFormat, args);
              result.completeExceptionally(
                  new ConsumerException.TopologyException(
                      "Error while trying to " + description + ": " + cause.getMessage(), cause));
            }
          }
        });
    return result;
  }
}
