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

/**
 * Creates {@link Transport} instances.
 *
 * @see com.vibebot.consumer.impl.AmqpClientTransportFactory
 */
@FunctionalInterface
public interface TransportFactory extends AutoCloseable {

  /**
   * Start opening a connection.
   *
   * <p>The method does not wait for the connection to be established, the outcome is reported to
   * the listener.
   *
   * @param listener the connection listener
   * @return the connection, not open yet
   */
  Transport open(Transport.Listener listener);

  /**
   * Release the resources of the factory.
   *
   * <p>Transports opened by the factory are not closed. A consumer closes its transport factory
   * on termination only when it created it.
   */
  @Override
  default void close() {}
}
