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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;

/** A message delivered by the broker, not acknowledged yet. */
public final class Delivery {

  private final long deliveryTag;
  private final byte[] body;
  private final Instant arrivalTime;

  @SuppressFBWarnings("EI_EXPOSE_REP2")
  public Delivery(long deliveryTag, byte[] body, Instant arrivalTime) {
    this.deliveryTag = deliveryTag;
    this.body = body;
    this.arrivalTime = arrivalTime;
  }

  public long deliveryTag() {
    return this.deliveryTag;
  }

  /**
   * The raw message body, as sent by the publisher.
   *
   * @return the body
   */
  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] body() {
    return this.body;
  }

  public Instant arrivalTime() {
    return this.arrivalTime;
  }

  @Override
  public String toString() {
    return "Delivery{" + "deliveryTag=" + deliveryTag + ", arrivalTime=" + arrivalTime + '}';
  }
}
