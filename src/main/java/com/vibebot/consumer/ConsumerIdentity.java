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

import java.util.Objects;

/**
 * Identity of a consumer instance: the bot it belongs to, the exchange it listens to and its
 * index among the instances of the same bot.
 *
 * <p>The queue and error queue names are derived from the bot ID and the exchange, so all the
 * instances of a bot share the same queues.
 */
public final class ConsumerIdentity {

  private final String botId;
  private final String exchange;
  private final int consumerIndex;
  private final String queueName;
  private final String errorQueueName;

  private ConsumerIdentity(String botId, String exchange, int consumerIndex) {
    if (botId == null || botId.isBlank()) {
      throw new IllegalArgumentException("Bot ID cannot be null or blank");
    }
    if (exchange == null || exchange.isBlank()) {
      throw new IllegalArgumentException("Exchange cannot be null or blank");
    }
    if (consumerIndex < 0) {
      throw new IllegalArgumentException("Consumer index must be positive or zero");
    }
    this.botId = botId;
    this.exchange = exchange;
    this.consumerIndex = consumerIndex;
    this.queueName = exchange + "-" + botId;
    this.errorQueueName = "error-" + botId + "-" + exchange;
  }

  public static ConsumerIdentity of(String botId, String exchange) {
    return of(botId, exchange, 0);
  }

  public static ConsumerIdentity of(String botId, String exchange, int consumerIndex) {
    return new ConsumerIdentity(botId, exchange, consumerIndex);
  }

  public String botId() {
    return this.botId;
  }

  public String exchange() {
    return this.exchange;
  }

  public int consumerIndex() {
    return this.consumerIndex;
  }

  /**
   * The durable queue bound to the exchange, <code>{exchange}-{botId}</code>.
   *
   * @return the queue name
   */
  public String queueName() {
    return this.queueName;
  }

  /**
   * The durable queue unprocessable messages are sent to, <code>error-{botId}-{exchange}</code>.
   *
   * @return the error queue name
   */
  public String errorQueueName() {
    return this.errorQueueName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ConsumerIdentity that = (ConsumerIdentity) o;
    return consumerIndex == that.consumerIndex
        && botId.equals(that.botId)
        && exchange.equals(that.exchange);
  }

  @Override
  public int hashCode() {
    return Objects.hash(botId, exchange, consumerIndex);
  }

  @Override
  public String toString() {
    return "ConsumerIdentity{"
        + "botId='"
        + botId
        + '\''
        + ", exchange='"
        + exchange
        + '\''
        + ", consumerIndex="
        + consumerIndex
        + '}';
  }
}
