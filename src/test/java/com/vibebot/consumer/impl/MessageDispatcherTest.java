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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.vibebot.consumer.ConsumerException;
import com.vibebot.consumer.ConsumerIdentity;
import com.vibebot.consumer.Delivery;
import com.vibebot.consumer.MessageHandler;
import com.vibebot.consumer.OutboundMessage;
import com.vibebot.consumer.TransportChannel;
import com.vibebot.consumer.metrics.MetricsCollector;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class MessageDispatcherTest {

  static final ConsumerIdentity IDENTITY = ConsumerIdentity.of("bot1", "bots");

  @Mock TransportChannel channel;
  @Mock MessageHandler handler;
  @Mock MetricsCollector metricsCollector;

  MessageDispatcher dispatcher;

  @BeforeEach
  void init() {
    dispatcher = new MessageDispatcher(IDENTITY, handler, new GsonMessageCodec(), metricsCollector);
  }

  @Test
  void messageShouldBeAckedBeforeHandlingAndResponsesPublishedWithDefaults() throws Exception {
    when(handler.handle(any()))
        .thenReturn(
            List.of(
                OutboundMessage.of("first"),
                OutboundMessage.of("second").toExchange("other"),
                OutboundMessage.of("third").withRoutingKey("rk")));

    dispatcher.dispatch(channel, delivery(42, "{\"text\":\"hello\"}"));

    InOrder inOrder = inOrder(channel, handler, metricsCollector);
    inOrder.verify(metricsCollector).receive();
    inOrder.verify(channel).ack(42);
    inOrder.verify(handler).handle(JsonParser.parseString("{\"text\":\"hello\"}"));
    inOrder.verify(channel).publish("bots", "bots-bot1", "first".getBytes(UTF_8));
    inOrder.verify(channel).publish("other", "bots-bot1", "second".getBytes(UTF_8));
    inOrder.verify(channel).publish("bots", "rk", "third".getBytes(UTF_8));
    inOrder.verify(metricsCollector).processTime(any(Duration.class));
    verify(metricsCollector, times(3)).publish();
    verify(metricsCollector, never()).error();
  }

  @Test
  void nullResponseListShouldPublishNothing() throws Exception {
    when(handler.handle(any())).thenReturn(null);
    dispatcher.dispatch(channel, delivery(1, "[1, 2]"));
    verify(channel).ack(1);
    verify(channel, never()).publish(anyString(), anyString(), any());
    verify(metricsCollector, never()).error();
  }

  @Test
  void handlerFailureShouldSendOriginalBodyToErrorQueue() throws Exception {
    when(handler.handle(any())).thenThrow(new IllegalStateException("boom"));
    dispatcher.dispatch(channel, delivery(1, "{\"a\":1}"));
    verify(channel).ack(1);
    verify(channel).publish("", "error-bot1-bots", "{\"a\":1}".getBytes(UTF_8));
    verify(metricsCollector).error();
    verify(metricsCollector, never()).publish();
    verify(metricsCollector).processTime(any(Duration.class));
  }

  @Test
  void errorThrownByHandlerShouldPropagateWithoutErrorQueue() throws Exception {
    when(handler.handle(any())).thenThrow(new AssertionError("handler error"));
    assertThatThrownBy(() -> dispatcher.dispatch(channel, delivery(1, "{}")))
        .isInstanceOf(AssertionError.class);
    verify(channel).ack(1);
    verify(channel, never()).publish(anyString(), anyString(), any());
    verify(metricsCollector, never()).error();
    verify(metricsCollector, never()).processTime(any(Duration.class));
  }

  @Test
  void invalidJsonShouldNotReachHandlerAndGoToErrorQueue() throws Exception {
    dispatcher.dispatch(channel, delivery(1, "{not json"));
    verify(channel).ack(1);
    verify(handler, never()).handle(any());
    verify(channel).publish("", "error-bot1-bots", "{not json".getBytes(UTF_8));
    verify(metricsCollector).error();
  }

  @Test
  void publishFailureShouldSendOriginalBodyToErrorQueue() throws Exception {
    when(handler.handle(any())).thenReturn(List.of(OutboundMessage.of("response")));
    doThrow(new ConsumerException.ChannelException(404, "NOT_FOUND", null))
        .when(channel)
        .publish("bots", "bots-bot1", "response".getBytes(UTF_8));
    dispatcher.dispatch(channel, delivery(1, "{}"));
    verify(channel).publish("", "error-bot1-bots", "{}".getBytes(UTF_8));
    verify(metricsCollector).error();
    verify(metricsCollector, never()).publish();
  }

  @Test
  void errorQueuePublishFailureShouldNotPropagate() throws Exception {
    when(handler.handle(any())).thenThrow(new IllegalStateException("boom"));
    doThrow(new ConsumerException.ConnectionException("connection lost"))
        .when(channel)
        .publish(eq(""), eq("error-bot1-bots"), any());
    dispatcher.dispatch(channel, delivery(1, "{}"));
    verify(metricsCollector).error();
    verify(metricsCollector).processTime(any(Duration.class));
  }

  @Test
  void ackFailureShouldPropagateAndSkipProcessing() throws Exception {
    doThrow(new ConsumerException.ChannelException(406, "PRECONDITION_FAILED", null))
        .when(channel)
        .ack(anyLong());
    assertThatThrownBy(() -> dispatcher.dispatch(channel, delivery(1, "{}")))
        .isInstanceOf(ConsumerException.ChannelException.class);
    verify(handler, never()).handle(any());
    verify(channel, never()).publish(anyString(), anyString(), any());
  }

  @Test
  void statsShouldBeResetEveryWindow() throws Exception {
    when(handler.handle(any(JsonElement.class))).thenReturn(List.of());
    IntStream.range(0, MessageDispatcher.STATS_WINDOW)
        .forEach(i -> dispatcher.dispatch(channel, delivery(i, "{}")));
    assertThat(dispatcher.stats().invocations()).isEqualTo(MessageDispatcher.STATS_WINDOW);
    assertThat(dispatcher.stats().totalProcessingTime()).isZero();
    verify(metricsCollector, times(MessageDispatcher.STATS_WINDOW)).receive();
  }

  static Delivery delivery(long tag, String body) {
    return new Delivery(tag, body.getBytes(UTF_8), Instant.now());
  }
}
