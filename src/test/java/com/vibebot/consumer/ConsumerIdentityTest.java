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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class ConsumerIdentityTest {

  @Test
  void queueNamesShouldBeDerivedFromBotIdAndExchange() {
    ConsumerIdentity identity = ConsumerIdentity.of("weather", "chat", 3);
    assertThat(identity.queueName()).isEqualTo("chat-weather");
    assertThat(identity.errorQueueName()).isEqualTo("error-weather-chat");
    assertThat(identity.consumerIndex()).isEqualTo(3);
  }

  @Test
  void defaultConsumerIndexIsZero() {
    assertThat(ConsumerIdentity.of("weather", "chat"))
        .isEqualTo(ConsumerIdentity.of("weather", "chat", 0))
        .hasSameHashCodeAs(ConsumerIdentity.of("weather", "chat", 0))
        .isNotEqualTo(ConsumerIdentity.of("weather", "chat", 1));
  }

  @Test
  void invalidValuesShouldBeRejected() {
    assertThatThrownBy(() -> ConsumerIdentity.of(null, "chat"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ConsumerIdentity.of("", "chat"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ConsumerIdentity.of("weather", " "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ConsumerIdentity.of("weather", "chat", -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
