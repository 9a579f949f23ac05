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

import com.vibebot.consumer.metrics.MetricsCollector;

/** API to configure and create a {@link BotConsumer}. */
public interface BotConsumerBuilder {

  /**
   * The bot the consumer belongs to.
   *
   * @param botId bot ID
   * @return this builder instance
   */
  BotConsumerBuilder botId(String botId);

  /**
   * The exchange to consume from. It must exist, the consumer does not create it.
   *
   * @param exchange exchange name
   * @return this builder instance
   */
  BotConsumerBuilder exchange(String exchange);

  /**
   * Index of the consumer among the instances of the same bot, for logging and failure
   * signaling. Default is 0.
   *
   * @param consumerIndex consumer index
   * @return this builder instance
   */
  BotConsumerBuilder consumerIndex(int consumerIndex);

  /**
   * Logic to process messages. Mandatory.
   *
   * @param handler the message handler
   * @return this builder instance
   */
  BotConsumerBuilder messageHandler(MessageHandler handler);

  /**
   * Decoder for message bodies. Default is strict JSON decoding.
   *
   * @param codec the codec
   * @return this builder instance
   */
  BotConsumerBuilder codec(MessageCodec codec);

  /**
   * Policy to wait before reconnecting. Default is a fixed 5-second delay, forever.
   *
   * @param policy back-off policy
   * @return this builder instance
   */
  BotConsumerBuilder reconnectDelayPolicy(BackOffDelayPolicy policy);

  /**
   * Callback to notify a supervisor when the consumer stops because of a failure.
   *
   * @param failureSignal the failure signal
   * @return this builder instance
   */
  BotConsumerBuilder failureSignal(FailureSignal failureSignal);

  /**
   * Metrics collector. Default is no metrics.
   *
   * @param metricsCollector metrics collector
   * @return this builder instance
   * @see com.vibebot.consumer.metrics.MicrometerMetricsCollector
   */
  BotConsumerBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Listeners of state changes.
   *
   * @param listeners state listeners
   * @return this builder instance
   */
  BotConsumerBuilder listeners(Resource.StateListener... listeners);

  /**
   * Factory for broker connections. Default uses the RabbitMQ Java client and the connection
   * settings.
   *
   * @param transportFactory transport factory
   * @return this builder instance
   */
  BotConsumerBuilder transportFactory(TransportFactory transportFactory);

  /**
   * Connection settings.
   *
   * @return the connection settings
   */
  BotConsumerConnectionSettings connectionSettings();

  /**
   * Create the consumer. It is not started.
   *
   * @return the configured consumer
   */
  BotConsumer build();

  /** Connection settings of a consumer builder. */
  interface BotConsumerConnectionSettings
      extends ConnectionSettings<BotConsumerConnectionSettings> {

    /**
     * The owning consumer builder.
     *
     * @return the consumer builder
     */
    BotConsumerBuilder consumerBuilder();
  }
}
