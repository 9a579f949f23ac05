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
 * A connection to the broker.
 *
 * <p>Implementations report what happens to the connection through a {@link Listener}. Listener
 * methods can be called from any thread.
 *
 * @see TransportFactory
 */
public interface Transport {

  /**
   * Request a new channel. The outcome is reported to the listener.
   *
   * @param listener the channel listener
   */
  void openChannel(TransportChannel.Listener listener);

  /**
   * Close the connection cleanly. {@link Listener#closed(int, String, boolean)} is called once
   * the connection is closed.
   */
  void close();

  /** Close the connection without waiting for the broker, ignoring any error. */
  void abort();

  boolean isOpen();

  /** Connection lifecycle callbacks. */
  interface Listener {

    /**
     * The connection is open.
     *
     * @param transport the connection
     */
    void opened(Transport transport);

    /**
     * The connection could not be established.
     *
     * @param cause failure cause
     */
    void openFailed(Throwable cause);

    /**
     * The connection has been closed, by the application or by the broker, or it has been lost.
     *
     * @param replyCode broker reply code, 0 if unknown
     * @param replyText broker reply text or failure description
     * @param initiatedByApplication whether the closing was requested by the application
     */
    void closed(int replyCode, String replyText, boolean initiatedByApplication);
  }
}
