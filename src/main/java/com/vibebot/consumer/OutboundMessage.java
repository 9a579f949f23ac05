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

import static java.nio.charset.StandardCharsets.UTF_8;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Message produced by a {@link MessageHandler}.
 *
 * <p>The exchange and the routing key are optional: the consumer publishes to its own exchange
 * and uses its own queue name as the routing key when they are not set.
 */
public final class OutboundMessage {

  private final String exchange;
  private final String routingKey;
  private final byte[] body;

  private OutboundMessage(String exchange, String routingKey, byte[] body) {
    if (body == null) {
      throw new IllegalArgumentException("Message body cannot be null");
    }
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.body = body;
  }

  public static OutboundMessage of(String body) {
    return new OutboundMessage(null, null, body == null ? null : body.getBytes(UTF_8));
  }

  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public static OutboundMessage of(byte[] body) {
    return new OutboundMessage(null, null, body);
  }

  /**
   * Copy of this message with the given target exchange.
   *
   * <p>Use the empty string to send the message directly to the queue named by the routing key.
   *
   * @param exchange target exchange
   * @return a new message
   */
  public OutboundMessage toExchange(String exchange) {
    return new OutboundMessage(exchange, this.routingKey, this.body);
  }

  /**
   * Copy of this message with the given routing key, usually a queue name.
   *
   * @param routingKey routing key
   * @return a new message
   */
  public OutboundMessage withRoutingKey(String routingKey) {
    return new OutboundMessage(this.exchange, routingKey, this.body);
  }

  /**
   * Target exchange, can be null.
   *
   * @return the exchange or null if the default one must be used
   */
  public String exchange() {
    return this.exchange;
  }

  /**
   * Routing key, can be null.
   *
   * @return the routing key or null if the default one must be used
   */
  public String routingKey() {
    return this.routingKey;
  }

  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] body() {
    return this.body;
  }

  @Override
  public String toString() {
    return "OutboundMessage{"
        + "exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", body="
        + new String(body, UTF_8)
        + '}';
  }
}
