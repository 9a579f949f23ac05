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

import static com.vibebot.consumer.Resource.State.CHANNEL_OPEN;
import static com.vibebot.consumer.Resource.State.CHANNEL_OPENING;
import static com.vibebot.consumer.Resource.State.CLOSED;
import static com.vibebot.consumer.Resource.State.CLOSING;
import static com.vibebot.consumer.Resource.State.CONNECTED;
import static com.vibebot.consumer.Resource.State.CONNECTING;
import static com.vibebot.consumer.Resource.State.CONSUMING;
import static com.vibebot.consumer.Resource.State.DISCONNECTED;

import com.vibebot.consumer.BackOffDelayPolicy;
import com.vibebot.consumer.BotConsumer;
import com.vibebot.consumer.ConsumerException;
import com.vibebot.consumer.ConsumerIdentity;
import com.vibebot.consumer.Delivery;
import com.vibebot.consumer.FailureSignal;
import com.vibebot.consumer.Transport;
import com.vibebot.consumer.TransportChannel;
import com.vibebot.consumer.TransportFactory;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BotConsumer} implementation.
 *
 * <p>All the state transitions happen in the consumer event loop. Transport callbacks are
 * enqueued in the loop and are dropped if they belong to a previous connection.
 */
final class AmqpBotConsumer extends ResourceBase implements BotConsumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpBotConsumer.class);

  static final int PREFETCH_COUNT = 1;

  private final ConsumerIdentity identity;
  private final TransportFactory transportFactory;
  private final boolean closeTransportFactory;
  private final BackOffDelayPolicy reconnectDelayPolicy;
  private final FailureSignal failureSignal;
  private final EventLoop loop;
  private final TopologyManager topologyManager;
  private final MessageDispatcher dispatcher;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final CompletableFuture<Void> terminated = new CompletableFuture<>();

  // event loop only
  private long generation = 0;
  private Session session = Session.NONE;
  private boolean closing = false;
  private Throwable pendingFailure;
  private int reconnectAttempt = 0;
  private ScheduledFuture<?> reconnectTask;

  AmqpBotConsumer(
      AmqpBotConsumerBuilder builder,
      TransportFactory transportFactory,
      boolean closeTransportFactory) {
    super(builder.listeners());
    this.identity = builder.identity();
    this.transportFactory = transportFactory;
    this.closeTransportFactory = closeTransportFactory;
    this.reconnectDelayPolicy = builder.reconnectDelayPolicy();
    this.failureSignal = builder.failureSignal();
    this.loop =
        new EventLoop(
            String.format(
                "bot-consumer-%s-%s-%d",
                this.identity.botId(),
                this.identity.exchange(),
                this.identity.consumerIndex()),
            this::onLoopError);
    this.topologyManager = new TopologyManager(this.identity, this.loop);
    this.dispatcher =
        new MessageDispatcher(
            this.identity, builder.messageHandler(), builder.codec(), builder.metricsCollector());
  }

  @Override
  public void start() {
    if (this.state() == CLOSED) {
      throw new ConsumerException.ConsumerClosedException("Consumer is closed");
    }
    if (!this.started.compareAndSet(false, true)) {
      throw new ConsumerException.ConsumerInvalidStateException(
          "Consumer has already been started, current state is %s", this.state());
    }
    this.loop.execute(this::connect);
  }

  /**
   * Stop consuming and close the connection.
   *
   * <p>Blocks until the consumer is closed, unless called from the consumer event loop. Can be
   * called several times, later calls wait for the same termination.
   */
  @Override
  public void stop() {
    if (this.state() != CLOSED) {
      this.loop.execute(this::requestStop);
    }
    if (!this.loop.inLoop()) {
      try {
        this.terminated.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (ExecutionException e) {
        LOGGER.debug("Unexpected termination failure", e);
      }
    }
  }

  @Override
  public boolean awaitTermination(Duration timeout) {
    try {
      this.terminated.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      return true;
    }
  }

  @Override
  public ConsumerIdentity identity() {
    return this.identity;
  }

  @Override
  public void close() {
    this.stop();
  }

  private void connect() {
    if (this.closing) {
      LOGGER.debug("Consumer {} is closing, not connecting", this.identity);
      return;
    }
    long gen = ++this.generation;
    LOGGER.info(
        "[{}]  Connecting to exchange {}", this.identity.botId(), this.identity.exchange());
    this.state(CONNECTING);
    Transport transport;
    try {
      transport = this.transportFactory.open(new ConnectionListener(gen));
    } catch (Exception e) {
      LOGGER.warn("Error while opening connection: {}", e.getMessage());
      this.session = new Session(gen, null, null, null);
      this.scheduleReconnect(new ConsumerException.ConnectionException(e.getMessage(), e));
      return;
    }
    this.session = new Session(gen, transport, null, null);
  }

  private void onConnectionOpen(long gen) {
    if (stale(gen)) {
      return;
    }
    LOGGER.info("Connection opened");
    if (this.closing) {
      this.closeConnection();
      return;
    }
    this.state(CONNECTED);
    LOGGER.info("Creating a new channel");
    this.state(CHANNEL_OPENING);
    try {
      this.session.transport.openChannel(new ChannelListener(gen));
    } catch (Exception e) {
      this.onSetupFailure(gen, e);
    }
  }

  private void onChannelOpen(long gen, TransportChannel channel) {
    if (stale(gen)) {
      return;
    }
    LOGGER.info("Channel opened");
    this.session = this.session.withChannel(channel);
    if (this.closing) {
      this.closeChannel();
      return;
    }
    this.state(CHANNEL_OPEN);
    CompletableFuture<Void> qos;
    try {
      qos = channel.basicQos(PREFETCH_COUNT);
    } catch (Exception e) {
      qos = CompletableFuture.failedFuture(e);
    }
    qos.thenComposeAsync(ignored -> this.topologyManager.declare(channel), this.loop)
        .whenCompleteAsync(
            (ignored, ex) -> {
              if (ex == null) {
                this.onTopologyReady(gen);
              } else {
                this.onSetupFailure(gen, ex);
              }
            },
            this.loop);
  }

  private void onTopologyReady(long gen) {
    if (stale(gen)) {
      return;
    }
    if (this.closing) {
      this.closeChannel();
      return;
    }
    LOGGER.info("Issuing consumer related RPC commands");
    LOGGER.info(
        "[{}]  Waiting for messages on exchange {}",
        this.identity.botId(),
        this.identity.exchange());
    CompletableFuture<String> consumeOk;
    try {
      consumeOk =
          this.session.channel.consume(this.identity.queueName(), new SubscriptionListener(gen));
    } catch (Exception e) {
      consumeOk = CompletableFuture.failedFuture(e);
    }
    consumeOk.whenCompleteAsync(
        (consumerTag, ex) -> {
          if (ex == null) {
            this.onConsumeOk(gen, consumerTag);
          } else {
            this.onSetupFailure(gen, ex);
          }
        },
        this.loop);
  }

  private void onConsumeOk(long gen, String consumerTag) {
    if (stale(gen)) {
      return;
    }
    this.session = this.session.withConsumerTag(consumerTag);
    this.reconnectAttempt = 0;
    if (this.closing) {
      this.cancelSubscription();
      return;
    }
    LOGGER.info(
        "Consumer {} consuming from queue '{}' with consumer tag {}",
        this.identity.consumerIndex(),
        this.identity.queueName(),
        consumerTag);
    this.state(CONSUMING);
  }

  private void onSetupFailure(long gen, Throwable ex) {
    if (stale(gen)) {
      return;
    }
    Throwable cause = ExceptionUtils.unwrap(ex);
    if (this.closing) {
      LOGGER.debug("Setup failure while closing: {}", cause.getMessage());
      this.closeChannel();
    } else if (cause instanceof ConsumerException.ConnectionException || !this.transportOpen()) {
      // the connection closed notification takes care of reconnecting
      LOGGER.debug("Setup interrupted by connection failure: {}", cause.getMessage());
    } else {
      this.failSetup(cause);
    }
  }

  private void failSetup(Throwable cause) {
    ConsumerException.TopologyException failure =
        cause instanceof ConsumerException.TopologyException
            ? (ConsumerException.TopologyException) cause
            : new ConsumerException.TopologyException(
                String.format(
                    "Could not set up consumer on exchange '%s': %s",
                    this.identity.exchange(), cause.getMessage()),
                cause);
    LOGGER.error(
        "[{}] Fatal error while setting up consumer on exchange '{}', "
            + "the exchange must exist and the queues must be declarable: {}",
        this.identity.botId(),
        this.identity.exchange(),
        failure.getMessage());
    this.closing = true;
    if (this.pendingFailure == null) {
      this.pendingFailure = failure;
    }
    this.state(CLOSING, failure);
    this.closeChannel();
  }

  private void onDelivery(long gen, Delivery delivery) {
    if (stale(gen) || this.session.channel == null) {
      LOGGER.debug("Ignoring delivery {} from previous channel", delivery.deliveryTag());
      return;
    }
    if (this.state() != CONSUMING) {
      LOGGER.debug(
          "Consumer is {}, delivery {} not processed", this.state(), delivery.deliveryTag());
      return;
    }
    try {
      this.dispatcher.dispatch(this.session.channel, delivery);
    } catch (ConsumerException e) {
      LOGGER.warn(
          "Could not acknowledge message {}, the channel should be closing: {}",
          delivery.deliveryTag(),
          e.getMessage());
    }
  }

  private void onConsumerCancelled(long gen, String consumerTag) {
    if (stale(gen)) {
      return;
    }
    LOGGER.info("Consumer was cancelled remotely, shutting down: {}", consumerTag);
    this.session = this.session.withConsumerTag(null);
    this.state(CLOSING);
    this.closeChannel();
  }

  private void onChannelClosed(long gen, int replyCode, String replyText) {
    if (stale(gen)) {
      return;
    }
    this.session = this.session.withChannel(null).withConsumerTag(null);
    if (this.closing) {
      LOGGER.info("Channel closed");
      this.closeConnection();
    } else if ((this.state() == CHANNEL_OPENING || this.state() == CHANNEL_OPEN)
        && this.transportOpen()) {
      this.failSetup(new ConsumerException.ChannelException(replyCode, replyText, null));
    } else {
      LOGGER.warn("Channel was closed: ({}) {}", replyCode, replyText);
      this.state(CLOSING);
      this.closeConnection();
    }
  }

  private void onConnectionClosed(long gen, int replyCode, String replyText) {
    if (stale(gen)) {
      return;
    }
    this.session = this.session.withChannel(null).withConsumerTag(null);
    if (this.closing) {
      LOGGER.info("Connection closed");
      this.terminate(this.pendingFailure);
    } else {
      this.scheduleReconnect(
          new ConsumerException.ConnectionException(
              "Connection closed: (%d) %s", replyCode, replyText));
    }
  }

  private void scheduleReconnect(Throwable cause) {
    if (this.reconnectTask != null) {
      LOGGER.debug("Reconnection already scheduled");
      return;
    }
    int attempt = this.reconnectAttempt++;
    Duration delay = this.reconnectDelayPolicy.delay(attempt);
    if (BackOffDelayPolicy.TIMEOUT.equals(delay)) {
      LOGGER.warn("Giving up reconnecting after {} attempt(s)", attempt);
      this.closing = true;
      this.terminate(
          new ConsumerException.ConnectionException(
              String.format("Could not reconnect after %d attempt(s)", attempt), cause));
      return;
    }
    LOGGER.warn(
        "Connection closed, reopening in {} ms: {}", delay.toMillis(), cause.getMessage());
    this.state(CONNECTING, cause);
    this.reconnectTask = this.loop.schedule(delay, this::reconnect);
  }

  private void reconnect() {
    this.reconnectTask = null;
    if (this.closing) {
      return;
    }
    Transport previous = this.session.transport;
    if (previous != null && previous.isOpen()) {
      previous.abort();
    }
    this.connect();
  }

  private void requestStop() {
    if (this.state() == CLOSED) {
      return;
    }
    if (this.closing) {
      LOGGER.debug("Consumer {} is already closing", this.identity);
      return;
    }
    LOGGER.info(
        "Stopping rabbit consumer {} with consumer id {}",
        this.identity.botId(),
        this.identity.consumerIndex());
    this.closing = true;
    State state = this.state();
    if (state == DISCONNECTED) {
      this.terminate(null);
    } else if (state == CONNECTING && this.reconnectTask != null) {
      this.reconnectTask.cancel(false);
      this.reconnectTask = null;
      this.terminate(null);
    } else if (state == CONNECTING && this.session.transport == null) {
      this.terminate(null);
    } else if (state == CONSUMING) {
      this.state(CLOSING);
      this.cancelSubscription();
    } else {
      // the ongoing step notices the closing flag and tears down
      this.state(CLOSING);
    }
  }

  private void cancelSubscription() {
    long gen = this.session.generation;
    TransportChannel channel = this.session.channel;
    String consumerTag = this.session.consumerTag;
    if (channel == null || consumerTag == null) {
      this.closeChannel();
      return;
    }
    LOGGER.info("Sending a Basic.Cancel RPC command to RabbitMQ");
    CompletableFuture<Void> cancelOk;
    try {
      cancelOk = channel.cancel(consumerTag);
    } catch (Exception e) {
      cancelOk = CompletableFuture.failedFuture(e);
    }
    cancelOk.whenCompleteAsync((ignored, ex) -> this.onCancelOk(gen, ex), this.loop);
  }

  private void onCancelOk(long gen, Throwable ex) {
    if (stale(gen)) {
      return;
    }
    if (ex == null) {
      LOGGER.info("RabbitMQ acknowledged the cancellation of the consumer");
    } else {
      LOGGER.warn(
          "Error while cancelling the consumer: {}", ExceptionUtils.unwrap(ex).getMessage());
    }
    this.session = this.session.withConsumerTag(null);
    this.closeChannel();
  }

  private void closeChannel() {
    TransportChannel channel = this.session.channel;
    if (channel != null && channel.isOpen()) {
      LOGGER.info("Closing the channel");
      channel.close();
    } else {
      this.closeConnection();
    }
  }

  private void closeConnection() {
    Transport transport = this.session.transport;
    if (transport != null && transport.isOpen()) {
      LOGGER.info("Closing connection");
      transport.close();
    } else {
      LOGGER.debug("Connection already closed");
    }
  }

  private void terminate(Throwable cause) {
    if (this.state() == CLOSED) {
      return;
    }
    this.closing = true;
    if (this.reconnectTask != null) {
      this.reconnectTask.cancel(false);
      this.reconnectTask = null;
    }
    Transport transport = this.session.transport;
    if (transport != null && transport.isOpen()) {
      transport.abort();
    }
    this.state(CLOSED, cause);
    if (cause == null) {
      LOGGER.info(
          "Stopped rabbit consumer {} with consumer id {}",
          this.identity.botId(),
          this.identity.consumerIndex());
    } else {
      LOGGER.warn(
          "Rabbit consumer {} with consumer id {} failed: {}",
          this.identity.botId(),
          this.identity.consumerIndex(),
          cause.getMessage());
      try {
        this.failureSignal.signal(this.identity, cause);
      } catch (Exception e) {
        LOGGER.warn("Error while signaling failure of consumer {}", this.identity, e);
      }
    }
    if (this.closeTransportFactory) {
      try {
        this.transportFactory.close();
      } catch (Exception e) {
        LOGGER.warn("Error while closing transport factory of consumer {}", this.identity, e);
      }
    }
    this.terminated.complete(null);
    this.loop.close();
  }

  private void onLoopError(Throwable e) {
    LOGGER.error("Unexpected error in consumer {}, closing it", this.identity, e);
    this.terminate(new ConsumerException("Unexpected error in consumer", e));
  }

  TransportFactory transportFactory() {
    return this.transportFactory;
  }

  private boolean stale(long gen) {
    boolean stale = gen != this.generation || this.state() == CLOSED;
    if (stale) {
      LOGGER.debug("Ignoring event of connection #{}, current is #{}", gen, this.generation);
    }
    return stale;
  }

  private boolean transportOpen() {
    return this.session.transport != null && this.session.transport.isOpen();
  }

  @Override
  public String toString() {
    return "AmqpBotConsumer{" + "identity=" + this.identity + '}';
  }

  private static final class Session {

    private static final Session NONE = new Session(0, null, null, null);

    private final long generation;
    private final Transport transport;
    private final TransportChannel channel;
    private final String consumerTag;

    private Session(
        long generation, Transport transport, TransportChannel channel, String consumerTag) {
      this.generation = generation;
      this.transport = transport;
      this.channel = channel;
      this.consumerTag = consumerTag;
    }

    private Session withChannel(TransportChannel channel) {
      return new Session(this.generation, this.transport, channel, this.consumerTag);
    }

    private Session withConsumerTag(String consumerTag) {
      return new Session(this.generation, this.transport, this.channel, consumerTag);
    }
  }

  private final class ConnectionListener implements Transport.Listener {

    private final long gen;

    private ConnectionListener(long gen) {
      this.gen = gen;
    }

    @Override
    public void opened(Transport transport) {
      loop.execute(() -> onConnectionOpen(this.gen));
    }

    @Override
    public void openFailed(Throwable cause) {
      loop.execute(
          () ->
              onConnectionClosed(this.gen, ExceptionUtils.NO_REPLY_CODE, String.valueOf(cause)));
    }

    @Override
    public void closed(int replyCode, String replyText, boolean initiatedByApplication) {
      loop.execute(() -> onConnectionClosed(this.gen, replyCode, replyText));
    }
  }

  private final class ChannelListener implements TransportChannel.Listener {

    private final long gen;

    private ChannelListener(long gen) {
      this.gen = gen;
    }

    @Override
    public void opened(TransportChannel channel) {
      loop.execute(() -> onChannelOpen(this.gen, channel));
    }

    @Override
    public void closed(int replyCode, String replyText) {
      loop.execute(() -> onChannelClosed(this.gen, replyCode, replyText));
    }
  }

  private final class SubscriptionListener implements TransportChannel.DeliveryListener {

    private final long gen;

    private SubscriptionListener(long gen) {
      this.gen = gen;
    }

    @Override
    public void delivery(Delivery delivery) {
      loop.execute(() -> onDelivery(this.gen, delivery));
    }

    @Override
    public void cancelled(String consumerTag) {
      loop.execute(() -> onConsumerCancelled(this.gen, consumerTag));
    }
  }
}
