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

import java.util.concurrent.CompletableFuture;

/**
 * A channel of a {@link Transport}.
 *
 * <p>Operations waiting for a broker response return a {@link CompletableFuture} completed when
 * the broker replies. They complete exceptionally with a {@link
 * ConsumerException.ChannelException} if the broker closes the channel, or with a {@link
 * ConsumerException.ConnectionException} if the connection is lost.
 */
public interface TransportChannel {

  /**
   * Check an exchange exists, without creating it.
   *
   * @param exchange exchange name
   * @return the broker response
   */
  CompletableFuture<Void> declareExchangePassive(String exchange);

  CompletableFuture<Void> declareQueue(String queue, boolean durable, boolean exclusive);

  CompletableFuture<Void> bindQueue(String queue, String exchange, String routingKey);

  /**
   * Set the maximum number of unacknowledged deliveries for consumers of this channel.
   *
   * @param prefetchCount prefetch count
   * @return the broker response
   */
  CompletableFuture<Void> basicQos(int prefetchCount);

  /**
   * Subscribe to a queue, with explicit acknowledgment.
   *
   * @param queue queue name
   * @param listener delivery and cancellation callbacks
   * @return the consumer tag assigned by the broker
   */
  CompletableFuture<String> consume(String queue, DeliveryListener listener);

  /**
   * Cancel a subscription.
   *
   * @param consumerTag the consumer tag
   * @return completed when the broker acknowledges the cancellation
   */
  CompletableFuture<Void> cancel(String consumerTag);

  /**
   * Acknowledge a delivery.
   *
   * @param deliveryTag the delivery tag
   * @throws ConsumerException if the channel is no longer usable
   */
  void ack(long deliveryTag);

  /**
   * Publish a message.
   *
   * @param exchange exchange, the empty string for the default exchange
   * @param routingKey routing key
   * @param body message body
   * @throws ConsumerException if the channel is no longer usable
   */
  void publish(String exchange, String routingKey, byte[] body);

  /**
   * Close the channel. {@link Listener#closed(int, String)} is called once it is closed.
   */
  void close();

  boolean isOpen();

  /** Channel lifecycle callbacks. */
  interface Listener {

    void opened(TransportChannel channel);

    /**
     * The channel has been closed, by the application or by the broker.
     *
     * <p>Not called when the channel is closed because its connection is closed.
     *
     * @param replyCode broker reply code
     * @param replyText broker reply text
     */
    void closed(int replyCode, String replyText);
  }

  /** Subscription callbacks. */
  interface DeliveryListener {

    void delivery(Delivery delivery);

    /**
     * The broker cancelled the subscription, e.g. because the queue has been deleted.
     *
     * @param consumerTag the consumer tag
     */
    void cancelled(String consumerTag);
  }
}
