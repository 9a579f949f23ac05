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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Collections;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 *
 * <p>Meter names are namespaced by a prefix, usually the exchange of the consumer: <code>
 * {prefix}.message.receive</code>, <code>{prefix}.message.publish</code>, <code>
 * {prefix}.message.error</code> (counters) and <code>{prefix}.message.process.time</code>
 * (timer).
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final Counter receive;
  private final Counter publish;
  private final Counter error;
  private final Timer processTime;

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.receive = registry.counter(prefix + ".message.receive", tags);
    this.publish = registry.counter(prefix + ".message.publish", tags);
    this.error = registry.counter(prefix + ".message.error", tags);
    this.processTime = registry.timer(prefix + ".message.process.time", tags);
  }

  @Override
  public void receive() {
    this.receive.increment();
  }

  @Override
  public void publish() {
    this.publish.increment();
  }

  @Override
  public void error() {
    this.error.increment();
  }

  @Override
  public void processTime(Duration duration) {
    this.processTime.record(duration);
  }
}
