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

public class ConsumerException extends RuntimeException {

  public ConsumerException(Throwable cause) {
    super(cause);
  }

  public ConsumerException(String format, Object... args) {
    super(String.format(format, args));
  }

  public ConsumerException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Network failure, connection refused or closed by the broker. */
  public static class ConnectionException extends ConsumerException {

    public ConnectionException(String message, Throwable cause) {
      super(message, cause);
    }

    public ConnectionException(String format, Object... args) {
      super(format, args);
    }
  }

  /** Channel closed by the broker, usually because of a protocol violation. */
  public static class ChannelException extends ConsumerException {

    private final int replyCode;
    private final String replyText;

    public ChannelException(int replyCode, String replyText, Throwable cause) {
      super(String.format("Channel closed by broker: (%d) %s", replyCode, replyText), cause);
      this.replyCode = replyCode;
      this.replyText = replyText;
    }

    public int replyCode() {
      return this.replyCode;
    }

    public String replyText() {
      return this.replyText;
    }
  }

  /**
   * The exchange does not exist or the broker rejected a queue declaration or binding.
   *
   * <p>This is a setup error that requires operator intervention, the consumer does not retry.
   */
  public static class TopologyException extends ConsumerException {

    public TopologyException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class MessageDecodingException extends ConsumerException {

    public MessageDecodingException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class ConsumerInvalidStateException extends ConsumerException {

    public ConsumerInvalidStateException(String format, Object... args) {
      super(format, args);
    }
  }

  public static class ConsumerClosedException extends ConsumerInvalidStateException {

    public ConsumerClosedException(String message) {
      super(message);
    }
  }
}
