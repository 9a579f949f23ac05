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

import static com.vibebot.consumer.impl.Utils.bodyAsString;

import com.google.gson.JsonElement;
import com.vibebot.consumer.ConsumerIdentity;
import com.vibebot.consumer.Delivery;
import com.vibebot.consumer.MessageCodec;
import com.vibebot.consumer.MessageHandler;
import com.vibebot.consumer.OutboundMessage;
import com.vibebot.consumer.TransportChannel;
import com.vibebot.consumer.metrics.MetricsCollector;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Processes one delivery: ack, decode, handle, publish responses, route failures. */
final class MessageDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageDispatcher.class);

  static final int STATS_WINDOW = 100;

  private final ConsumerIdentity identity;
  private final MessageHandler handler;
  private final MessageCodec codec;
  private final MetricsCollector metricsCollector;
  private final RollingStats stats = new RollingStats(STATS_WINDOW);

  MessageDispatcher(
      ConsumerIdentity identity,
      MessageHandler handler,
      MessageCodec codec,
      MetricsCollector metricsCollector) {
    this.identity = identity;
    this.handler = handler;
    this.codec = codec;
    this.metricsCollector = metricsCollector;
  }

  /**
   * Process a delivery on the channel it arrived on.
   *
   * <p>Processing exceptions are routed to the error queue. A failure to acknowledge the delivery
   * propagates, and so does an {@link Error} thrown by the handler, which ends the consumer.
   *
   * @param channel the channel of the delivery
   * @param delivery the delivery
   */
  void dispatch(TransportChannel channel, Delivery delivery) {
    Utils.StopWatch stopWatch = new Utils.StopWatch();
    this.stats.increment();
    String botId = this.identity.botId();
    byte[] body = delivery.body();
    LOGGER.info(
        "[{}] received message #{} from exchange {}: {}",
        botId,
        delivery.deliveryTag(),
        this.identity.exchange(),
        bodyAsString(body));
    if (delivery.arrivalTime() != null) {
      LOGGER.debug(
          "Message #{} waited {}ms before dispatch",
          delivery.deliveryTag(),
          Duration.between(delivery.arrivalTime(), Instant.now()).toMillis());
    }
    this.metricsCollector.receive();

    // Acked before processing: a crash during processing loses the message.
    // TODO persist the message locally before the ack
    LOGGER.info(
        "Acknowledging message {} consumer {}",
        delivery.deliveryTag(),
        this.identity.consumerIndex());
    channel.ack(delivery.deliveryTag());

    try {
      JsonElement message = decode(body);
      List<OutboundMessage> responses = this.handler.handle(message);
      if (responses == null) {
        responses = Collections.emptyList();
      }
      LOGGER.info("[{}] Sending {} response messages", botId, responses.size());
      for (OutboundMessage response : responses) {
        String exchange =
            response.exchange() == null ? this.identity.exchange() : response.exchange();
        String routingKey =
            response.routingKey() == null ? this.identity.queueName() : response.routingKey();
        channel.publish(exchange, routingKey, response.body());
        LOGGER.info("[{}] published message {}", botId, response);
        this.metricsCollector.publish();
      }
    } catch (Exception e) {
      this.metricsCollector.error();
      LOGGER.error(
          "[{}] Unexpected error - {}, message {}, from exchange {}. sending to error queue {}",
          botId,
          e.getMessage(),
          bodyAsString(body),
          this.identity.exchange(),
          this.identity.errorQueueName(),
          e);
      routeToErrorQueue(channel, body);
    }

    Duration processingTime = stopWatch.stop();
    long processingTimeMs = processingTime.toMillis();
    LOGGER.debug(
        "Consumer {} message handling time: {}ms", this.identity.consumerIndex(), processingTimeMs);
    OptionalLong average = this.stats.record(processingTimeMs);
    if (average.isPresent()) {
      LOGGER.info(
          "Consumer {} Avg message handling time (last {}): {}ms",
          this.identity.consumerIndex(),
          STATS_WINDOW,
          average.getAsLong());
    }
    this.metricsCollector.processTime(processingTime);
  }

  private JsonElement decode(byte[] body) {
    try {
      return this.codec.decode(body);
    } catch (RuntimeException e) {
      LOGGER.error(
          "[{}] Error decoding message {}: {}",
          this.identity.botId(),
          bodyAsString(body),
          e.getMessage());
      throw e;
    }
  }

  private void routeToErrorQueue(TransportChannel channel, byte[] body) {
    try {
      channel.publish("", this.identity.errorQueueName(), body);
    } catch (Exception e) {
      LOGGER.warn(
          "[{}] Could not send message to error queue {}: {}",
          this.identity.botId(),
          this.identity.errorQueueName(),
          e.getMessage());
    }
  }

  RollingStats stats() {
    return this.stats;
  }
}
