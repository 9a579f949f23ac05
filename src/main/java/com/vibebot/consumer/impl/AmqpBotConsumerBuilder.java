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

import com.vibebot.consumer.BackOffDelayPolicy;
import com.vibebot.consumer.BotConsumer;
import com.vibebot.consumer.BotConsumerBuilder;
import com.vibebot.consumer.ConsumerIdentity;
import com.vibebot.consumer.FailureSignal;
import com.vibebot.consumer.MessageCodec;
import com.vibebot.consumer.MessageHandler;
import com.vibebot.consumer.Resource;
import com.vibebot.consumer.TransportFactory;
import com.vibebot.consumer.metrics.MetricsCollector;
import com.vibebot.consumer.metrics.NoOpMetricsCollector;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builder for {@link BotConsumer} instances.
 *
 * <p>Bot ID, exchange and message handler are mandatory.
 */
public class AmqpBotConsumerBuilder implements BotConsumerBuilder {

  static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

  private final DefaultBotConsumerConnectionSettings connectionSettings =
      new DefaultBotConsumerConnectionSettings(this);
  private String botId;
  private String exchange;
  private int consumerIndex = 0;
  private MessageHandler messageHandler;
  private MessageCodec codec = new GsonMessageCodec();
  private BackOffDelayPolicy reconnectDelayPolicy =
      BackOffDelayPolicy.fixed(DEFAULT_RECONNECT_DELAY);
  private FailureSignal failureSignal = FailureSignal.NO_OP;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private final List<Resource.StateListener> listeners = new ArrayList<>();
  private TransportFactory transportFactory;
  private ConsumerIdentity identity;

  public AmqpBotConsumerBuilder() {}

  @Override
  public AmqpBotConsumerBuilder botId(String botId) {
    this.botId = botId;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder exchange(String exchange) {
    this.exchange = exchange;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder consumerIndex(int consumerIndex) {
    this.consumerIndex = consumerIndex;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder messageHandler(MessageHandler handler) {
    this.messageHandler = handler;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder codec(MessageCodec codec) {
    if (codec == null) {
      throw new IllegalArgumentException("Codec cannot be null");
    }
    this.codec = codec;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder reconnectDelayPolicy(BackOffDelayPolicy policy) {
    if (policy == null) {
      throw new IllegalArgumentException("Reconnect delay policy cannot be null");
    }
    this.reconnectDelayPolicy = policy;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder failureSignal(FailureSignal failureSignal) {
    this.failureSignal = failureSignal == null ? FailureSignal.NO_OP : failureSignal;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(Arrays.asList(listeners));
    }
    return this;
  }

  @Override
  public AmqpBotConsumerBuilder transportFactory(TransportFactory transportFactory) {
    this.transportFactory = transportFactory;
    return this;
  }

  @Override
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public BotConsumerConnectionSettings connectionSettings() {
    return this.connectionSettings;
  }

  @Override
  public BotConsumer build() {
    if (this.messageHandler == null) {
      throw new IllegalArgumentException("Message handler cannot be null");
    }
    this.identity = ConsumerIdentity.of(this.botId, this.exchange, this.consumerIndex);
    if (this.transportFactory == null) {
      this.connectionSettings.consolidate();
      TransportFactory defaultTransportFactory =
          new AmqpClientTransportFactory(
              AmqpClientTransportFactory.connectionFactory(this.connectionSettings),
              String.format(
                  "bot-consumer-%s-%s-%d", this.botId, this.exchange, this.consumerIndex));
      return new AmqpBotConsumer(this, defaultTransportFactory, true);
    } else {
      return new AmqpBotConsumer(this, this.transportFactory, false);
    }
  }

  ConsumerIdentity identity() {
    return this.identity;
  }

  MessageHandler messageHandler() {
    return this.messageHandler;
  }

  MessageCodec codec() {
    return this.codec;
  }

  BackOffDelayPolicy reconnectDelayPolicy() {
    return this.reconnectDelayPolicy;
  }

  FailureSignal failureSignal() {
    return this.failureSignal;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }

  static class DefaultBotConsumerConnectionSettings
      extends DefaultConnectionSettings<BotConsumerConnectionSettings>
      implements BotConsumerConnectionSettings {

    private final AmqpBotConsumerBuilder builder;

    DefaultBotConsumerConnectionSettings(AmqpBotConsumerBuilder builder) {
      this.builder = builder;
    }

    @Override
    BotConsumerConnectionSettings toReturn() {
      return this;
    }

    @Override
    public AmqpBotConsumerBuilder consumerBuilder() {
      return this.builder;
    }
  }
}
