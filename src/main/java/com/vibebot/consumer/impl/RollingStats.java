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

import java.util.OptionalLong;

/**
 * Counts handled messages and reports the average processing time every {@code window}
 * invocations.
 *
 * <p>Not thread-safe, meant to be used from the consumer event loop only.
 */
final class RollingStats {

  private final int window;
  private long invocations;
  private long totalProcessingTime;

  RollingStats(int window) {
    if (window <= 0) {
      throw new IllegalArgumentException("Window must be positive");
    }
    this.window = window;
  }

  void increment() {
    this.invocations++;
  }

  /**
   * Record the processing time of the current invocation.
   *
   * @param processingTimeMs processing time in milliseconds
   * @return the average over the window if the window is complete, empty otherwise
   */
  OptionalLong record(long processingTimeMs) {
    this.totalProcessingTime += processingTimeMs;
    if (this.invocations > 0 && this.invocations % this.window == 0) {
      long average = this.totalProcessingTime / this.window;
      this.totalProcessingTime = 0;
      return OptionalLong.of(average);
    } else {
      return OptionalLong.empty();
    }
  }

  long invocations() {
    return this.invocations;
  }

  long totalProcessingTime() {
    return this.totalProcessingTime;
  }
}
