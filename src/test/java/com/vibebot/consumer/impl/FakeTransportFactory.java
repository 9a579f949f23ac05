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

import com.vibebot.consumer.ConsumerException;
import com.vibebot.consumer.Delivery;
import com.vibebot.consumer.Transport;
import com.vibebot.consumer.TransportChannel;
import com.vibebot.consumer.TransportFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** In-memory broker connections, recording the operations of each channel. */
final class FakeTransportFactory implements TransportFactory {

  static final int NOT_FOUND = 404;

  private final List<FakeTransport> transports = new CopyOnWriteArrayList<>();
  private final Set<String> missingExchanges = ConcurrentHashMap.newKeySet();
  private final AtomicInteger failingOpenings = new AtomicInteger(0);
  private final AtomicLong consumerTagSequence = new AtomicLong(0);
  private volatile boolean closed = false;

  @Override
  public Transport open(Transport.Listener listener) {
    FakeTransport transport = new FakeTransport(listener);
    this.transports.add(transport);
    if (this.failingOpenings.getAndUpdate(v -> v > 0 ? v - 1 : v) != 0) {
      transport.open = false;
      listener.openFailed(new ConsumerException.ConnectionException("Connection refused"));
    } else {
      listener.opened(transport);
    }
    return transport;
  }

  @Override
  public void close() {
    this.closed = true;
  }

  boolean isClosed() {
    return this.closed;
  }

  /**
   * Fail the next connection openings.
   *
   * @param count number of failing openings, negative to fail all of them
   */
  FakeTransportFactory failOpenings(int count) {
    this.failingOpenings.set(count);
    return this;
  }

  FakeTransportFactory missingExchange(String exchange) {
    this.missingExchanges.add(exchange);
    return this;
  }

  List<FakeTransport> transports() {
    return this.transports;
  }

  int openings() {
    return this.transports.size();
  }

  FakeTransport lastTransport() {
    return this.transports.get(this.transports.size() - 1);
  }

  FakeChannel lastChannel() {
    return this.lastTransport().lastChannel();
  }

  final class FakeTransport implements Transport {

    private final Transport.Listener listener;
    private final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    private final long requestedAt = System.nanoTime();
    private volatile long serverClosedAt = -1;
    private volatile boolean open = true;
    private volatile boolean closedByClient = false;

    private FakeTransport(Transport.Listener listener) {
      this.listener = listener;
    }

    @Override
    public void openChannel(TransportChannel.Listener channelListener) {
      if (!this.open) {
        throw new ConsumerException.ConnectionException("Connection is closed");
      }
      FakeChannel channel = new FakeChannel(channelListener);
      this.channels.add(channel);
      channelListener.opened(channel);
    }

    @Override
    public void close() {
      if (this.open) {
        this.open = false;
        this.closedByClient = true;
        this.channels.forEach(c -> c.open = false);
        this.listener.closed(200, "OK", true);
      }
    }

    @Override
    public void abort() {
      this.close();
    }

    @Override
    public boolean isOpen() {
      return this.open;
    }

    /** Simulate a connection lost or closed by the broker. */
    void serverClose(int replyCode, String replyText) {
      if (this.open) {
        this.open = false;
        this.serverClosedAt = System.nanoTime();
        this.channels.forEach(c -> c.open = false);
        this.listener.closed(replyCode, replyText, false);
      }
    }

    boolean closedByClient() {
      return this.closedByClient;
    }

    /** Time between the broker closing this connection and the opening of the given one. */
    Duration gapUntil(FakeTransport next) {
      if (this.serverClosedAt < 0) {
        throw new IllegalStateException("Connection has not been closed by the broker");
      }
      return Duration.ofNanos(next.requestedAt - this.serverClosedAt);
    }

    List<FakeChannel> channels() {
      return this.channels;
    }

    FakeChannel lastChannel() {
      return this.channels.get(this.channels.size() - 1);
    }
  }

  final class FakeChannel implements TransportChannel {

    private final TransportChannel.Listener listener;
    private final List<String> operations = new CopyOnWriteArrayList<>();
    private final List<Published> published = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile DeliveryListener deliveryListener;
    private volatile String consumerTag;

    private FakeChannel(TransportChannel.Listener listener) {
      this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> declareExchangePassive(String exchange) {
      record("exchange.declare-passive %s", exchange);
      if (missingExchanges.contains(exchange)) {
        String replyText = String.format("NOT_FOUND - no exchange '%s' in vhost '/'", exchange);
        this.serverClose(NOT_FOUND, replyText);
        return CompletableFuture.failedFuture(
            new ConsumerException.ChannelException(NOT_FOUND, replyText, null));
      }
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> declareQueue(String queue, boolean durable, boolean exclusive) {
      record("queue.declare %s durable=%s exclusive=%s", queue, durable, exclusive);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> bindQueue(String queue, String exchange, String routingKey) {
      record("queue.bind %s %s '%s'", queue, exchange, routingKey);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> basicQos(int prefetchCount) {
      record("basic.qos %d", prefetchCount);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<String> consume(String queue, DeliveryListener listener) {
      record("basic.consume %s", queue);
      this.deliveryListener = listener;
      this.consumerTag = "ctag-" + consumerTagSequence.incrementAndGet();
      return CompletableFuture.completedFuture(this.consumerTag);
    }

    @Override
    public CompletableFuture<Void> cancel(String consumerTag) {
      record("basic.cancel %s", consumerTag);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public void ack(long deliveryTag) {
      checkOpen();
      record("basic.ack %d", deliveryTag);
    }

    @Override
    public void publish(String exchange, String routingKey, byte[] body) {
      checkOpen();
      record("basic.publish %s %s", exchange, routingKey);
      this.published.add(new Published(exchange, routingKey, body));
    }

    @Override
    public void close() {
      if (this.open) {
        record("channel.close");
        this.open = false;
        this.listener.closed(200, "OK");
      }
    }

    @Override
    public boolean isOpen() {
      return this.open;
    }

    void deliver(long deliveryTag, String body) {
      this.deliveryListener.delivery(
          new Delivery(deliveryTag, body.getBytes(UTF_8), Instant.now()));
    }

    /** Simulate a consumer cancellation by the broker, e.g. when the queue is deleted. */
    void brokerCancel() {
      this.deliveryListener.cancelled(this.consumerTag);
    }

    /** Simulate a channel-level error raised by the broker. */
    void serverClose(int replyCode, String replyText) {
      if (this.open) {
        this.open = false;
        this.listener.closed(replyCode, replyText);
      }
    }

    List<String> operations() {
      return this.operations;
    }

    List<Published> published() {
      return this.published;
    }

    String consumerTag() {
      return this.consumerTag;
    }

    private void record(String format, Object... args) {
      this.operations.add(String.format(format, args));
    }

    private void checkOpen() {
      if (!this.open) {
        throw new ConsumerException.ChannelException(406, "channel is closed", null);
      }
    }
  }

  static final class Published {

    private final String exchange;
    private final String routingKey;
    private final byte[] body;

    private Published(String exchange, String routingKey, byte[] body) {
      this.exchange = exchange;
      this.routingKey = routingKey;
      this.body = body;
    }

    String exchange() {
      return this.exchange;
    }

    String routingKey() {
      return this.routingKey;
    }

    String body() {
      return new String(this.body, UTF_8);
    }

    @Override
    public String toString() {
      return exchange + "/" + routingKey + ": " + body();
    }
  }
}
