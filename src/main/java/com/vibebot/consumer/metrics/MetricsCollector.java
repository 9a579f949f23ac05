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
package com.vibebot.consumer.metrics;

import java.time.Duration;

/** Interface to collect execution data of a consumer. */
public interface MetricsCollector {

  /** Called when a message is received, before it is processed. */
  void receive();

  /** Called for each message published by the handler of a received message. */
  void publish();

  /** Called when a received message cannot be processed and goes to the error queue. */
  void error();

  /**
   * Called once a received message has been processed, successfully or not.
   *
   * @param duration processing time
   */
  void processTime(Duration duration);
}
