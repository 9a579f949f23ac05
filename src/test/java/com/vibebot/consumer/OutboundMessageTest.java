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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class OutboundMessageTest {

  @Test
  void exchangeAndRoutingKeyAreUnsetByDefault() {
    OutboundMessage message = OutboundMessage.of("{\"reply\":\"hi\"}");
    assertThat(message.exchange()).isNull();
    assertThat(message.routingKey()).isNull();
    assertThat(message.body()).isEqualTo("{\"reply\":\"hi\"}".getBytes(UTF_8));
  }

  @Test
  void targetShouldBeOverridable() {
    OutboundMessage original = OutboundMessage.of("x");
    OutboundMessage routed = original.toExchange("other").withRoutingKey("rk");
    assertThat(routed.exchange()).isEqualTo("other");
    assertThat(routed.routingKey()).isEqualTo("rk");
    assertThat(original.exchange()).isNull();
    assertThat(original.routingKey()).isNull();
  }

  @Test
  void bodyIsMandatory() {
    assertThatThrownBy(() -> OutboundMessage.of((String) null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> OutboundMessage.of((byte[]) null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
