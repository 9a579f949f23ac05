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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import com.vibebot.consumer.ConsumerException;
import com.vibebot.consumer.Delivery;
import com.vibebot.consumer.Transport;
import com.vibebot.consumer.TransportChannel;
import com.vibebot.consumer.TransportFactory;
import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TransportFactory} based on the RabbitMQ Java client (AMQP 0.9.1).
 *
 * <p>Connections are opened in a background thread. Automatic recovery of the client library is
 * disabled, the consumer reconnects itself.
 */
public class AmqpClientTransportFactory implements TransportFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpClientTransportFactory.class);

  private final ConnectionFactory connectionFactory;
  private final String connectionName;
  private final ExecutorService executorService;

  public AmqpClientTransportFactory(ConnectionFactory connectionFactory, String connectionName) {
    this.connectionFactory = connectionFactory;
    this.connectionName = connectionName;
    this.executorService = Utils.executorService("%s-connection-", connectionName);
  }

  static ConnectionFactory connectionFactory(DefaultConnectionSettings<?> settings) {
    ConnectionFactory cf = new ConnectionFactory();
    cf.setHost(settings.host());
    cf.setPort(settings.port());
    cf.setUsername(settings.username());
    cf.setPassword(settings.password());
    cf.setVirtualHost(settings.virtualHost());
    cf.setConnectionTimeout((int) settings.connectionTimeout().toMillis());
    cf.setAutomaticRecoveryEnabled(false);
    cf.setTopologyRecoveryEnabled(false);
    return cf;
  }

  @Override
  public Transport open(Transport.Listener listener) {
    AmqpClientTransport transport = new AmqpClientTransport(listener);
    this.executorService.execute(transport::connect);
    return transport;
  }

  @Override
  public void close() {
    // interrupts a connection attempt still in progress
    this.executorService.shutdownNow();
  }

  boolean isClosed() {
    return this.executorService.isShutdown();
  }

  private class AmqpClientTransport implements Transport {

    private final Transport.Listener listener;
    private final AtomicBoolean closeRequested = new AtomicBoolean(false);
    private volatile Connection connection;

    private AmqpClientTransport(Transport.Listener listener) {
      this.listener = listener;
    }

    private void connect() {
      Connection c;
      try {
        c = connectionFactory.newConnection(connectionName);
      } catch (IOException | TimeoutException | RuntimeException e) {
        LOGGER.debug("Error while opening connection: {}", e.getMessage());
        this.listener.openFailed(ExceptionUtils.convert(e));
        return;
      }
      this.connection = c;
      if (this.closeRequested.get()) {
        c.abort();
        this.listener.openFailed(
            new ConsumerException.ConnectionException("Connection closed while opening"));
        return;
      }
      this.listener.opened(this);
      // called immediately if the connection is already closed
      c.addShutdownListener(
          cause ->
              this.listener.closed(
                  ExceptionUtils.replyCode(cause),
                  ExceptionUtils.replyText(cause),
                  cause.isInitiatedByApplication()));
    }

    @Override
    public void openChannel(TransportChannel.Listener channelListener) {
      Connection c = this.connection;
      if (c == null) {
        throw new ConsumerException.ConnectionException("Connection is not open");
      }
      Channel channel;
      try {
        channel = c.createChannel();
      } catch (IOException | AlreadyClosedException e) {
        throw ExceptionUtils.convert(e);
      }
      if (channel == null) {
        throw new ConsumerException("No channel available");
      }
      channelListener.opened(new AmqpClientChannel(channel));
      channel.addShutdownListener(
          cause -> {
            // connection-level closing is notified by the connection
            if (!cause.isHardError()) {
              channelListener.closed(
                  ExceptionUtils.replyCode(cause), ExceptionUtils.replyText(cause));
            }
          });
    }

    @Override
    public void close() {
      this.closeRequested.set(true);
      Connection c = this.connection;
      if (c != null && c.isOpen()) {
        try {
          c.close();
        } catch (IOException | AlreadyClosedException e) {
          LOGGER.debug("Error while closing connection: {}", e.getMessage());
          c.abort();
        }
      }
    }

    @Override
    public void abort() {
      this.closeRequested.set(true);
      Connection c = this.connection;
      if (c != null) {
        c.abort();
      }
    }

    @Override
    public boolean isOpen() {
      Connection c = this.connection;
      return c != null && c.isOpen();
    }
  }

  private static class AmqpClientChannel implements TransportChannel {

    private final Channel channel;

    private AmqpClientChannel(Channel channel) {
      this.channel = channel;
    }

    @Override
    public CompletableFuture<Void> declareExchangePassive(String exchange) {
      return call(() -> this.channel.exchangeDeclarePassive(exchange));
    }

    @Override
    public CompletableFuture<Void> declareQueue(String queue, boolean durable, boolean exclusive) {
      return call(() -> this.channel.queueDeclare(queue, durable, exclusive, false, null));
    }

    @Override
    public CompletableFuture<Void> bindQueue(String queue, String exchange, String routingKey) {
      return call(() -> this.channel.queueBind(queue, exchange, routingKey));
    }

    @Override
    public CompletableFuture<Void> basicQos(int prefetchCount) {
      return call(() -> this.channel.basicQos(prefetchCount));
    }

    @Override
    public CompletableFuture<String> consume(String queue, DeliveryListener listener) {
      try {
        String consumerTag =
            this.channel.basicConsume(
                queue,
                false,
                new DefaultConsumer(this.channel) {
                  @Override
                  public void handleDelivery(
                      String consumerTag,
                      Envelope envelope,
                      AMQP.BasicProperties properties,
                      byte[] body) {
                    listener.delivery(new Delivery(envelope.getDeliveryTag(), body, Instant.now()));
                  }

                  @Override
                  public void handleCancel(String consumerTag) {
                    listener.cancelled(consumerTag);
                  }
                });
        return CompletableFuture.completedFuture(consumerTag);
      } catch (IOException | ShutdownSignalException e) {
        return CompletableFuture.failedFuture(ExceptionUtils.convert(e));
      }
    }

    @Override
    public CompletableFuture<Void> cancel(String consumerTag) {
      return call(() -> this.channel.basicCancel(consumerTag));
    }

    @Override
    public void ack(long deliveryTag) {
      try {
        this.channel.basicAck(deliveryTag, false);
      } catch (IOException | ShutdownSignalException e) {
        throw ExceptionUtils.convert(e);
      }
    }

    @Override
    public void publish(String exchange, String routingKey, byte[] body) {
      try {
        this.channel.basicPublish(exchange, routingKey, null, body);
      } catch (IOException | ShutdownSignalException e) {
        throw ExceptionUtils.convert(e);
      }
    }

    @Override
    public void close() {
      try {
        if (this.channel.isOpen()) {
          this.channel.close();
        }
      } catch (IOException | TimeoutException | ShutdownSignalException e) {
        LOGGER.debug("Error while closing channel: {}", e.getMessage());
      }
    }

    @Override
    public boolean isOpen() {
      return this.channel.isOpen();
    }

    private static CompletableFuture<Void> call(IoOperation operation) {
      try {
        operation.run();
        return CompletableFuture.completedFuture(null);
      } catch (IOException | ShutdownSignalException e) {
        return CompletableFuture.failedFuture(ExceptionUtils.convert(e));
      }
    }
  }

  @FunctionalInterface
  private interface IoOperation {

    void run() throws IOException;
  }
}
