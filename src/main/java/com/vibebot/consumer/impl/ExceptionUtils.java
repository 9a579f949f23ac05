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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;
import com.vibebot.consumer.ConsumerException;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

abstract class ExceptionUtils {

  static final int NO_REPLY_CODE = 0;

  private ExceptionUtils() {}

  static Throwable unwrap(Throwable e) {
    Throwable result = e;
    while ((result instanceof CompletionException || result instanceof ExecutionException)
        && result.getCause() != null) {
      result = result.getCause();
    }
    return result;
  }

  static ConsumerException convert(Throwable e) {
    Throwable cause = unwrap(e);
    if (cause instanceof ConsumerException) {
      return (ConsumerException) cause;
    } else if (cause instanceof ShutdownSignalException) {
      return convert((ShutdownSignalException) cause);
    } else if (cause instanceof IOException
        && cause.getCause() instanceof ShutdownSignalException) {
      return convert((ShutdownSignalException) cause.getCause());
    } else if (cause instanceof IOException || cause instanceof TimeoutException) {
      return new ConsumerException.ConnectionException(cause.getMessage(), cause);
    } else {
      return new ConsumerException(cause);
    }
  }

  static ConsumerException convert(ShutdownSignalException e) {
    if (e.isHardError()) {
      return new ConsumerException.ConnectionException(
          String.format("Connection closed: (%d) %s", replyCode(e), replyText(e)), e);
    } else {
      return new ConsumerException.ChannelException(replyCode(e), replyText(e), e);
    }
  }

  static int replyCode(ShutdownSignalException e) {
    Method reason = e.getReason();
    if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyCode();
    } else if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyCode();
    } else {
      return NO_REPLY_CODE;
    }
  }

  static String replyText(ShutdownSignalException e) {
    Method reason = e.getReason();
    if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyText();
    } else if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyText();
    } else if (e.getCause() != null) {
      return e.getCause().toString();
    } else {
      return e.getMessage();
    }
  }
}
