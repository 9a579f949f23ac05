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

import com.google.gson.JsonElement;
import java.util.List;

/**
 * Contract to process a decoded message.
 *
 * <p>The handler runs on the event loop of the consumer, it must not block. Any exception it
 * throws sends the original message to the error queue.
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * Process a message.
   *
   * @param message the decoded message body
   * @return the messages to publish, in order, can be null or empty
   * @throws Exception if the message cannot be processed
   */
  List<OutboundMessage> handle(JsonElement message) throws Exception;
}
