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

import com.vibebot.consumer.ConnectionSettings;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.time.Duration;

abstract class DefaultConnectionSettings<T> implements ConnectionSettings<T> {

  static final String DEFAULT_HOST = "localhost";
  static final int DEFAULT_PORT = 5672;
  static final String DEFAULT_USERNAME = "guest";
  static final String DEFAULT_PASSWORD = "guest";
  static final String DEFAULT_VIRTUAL_HOST = "/";
  static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(1);

  private String host = DEFAULT_HOST;
  private int port = DEFAULT_PORT;
  private String username = DEFAULT_USERNAME;
  private String password = DEFAULT_PASSWORD;
  private String virtualHost = DEFAULT_VIRTUAL_HOST;
  private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
  private URI uri;

  @Override
  public T uri(String uriString) {
    if (uriString == null) {
      throw new IllegalArgumentException("URI cannot be null");
    }
    this.uri = toUri(uriString);
    return toReturn();
  }

  @Override
  public T host(String host) {
    this.host = host;
    return toReturn();
  }

  @Override
  public T port(int port) {
    this.port = port;
    return toReturn();
  }

  @Override
  public T username(String username) {
    this.username = username;
    return toReturn();
  }

  @Override
  public T password(String password) {
    this.password = password;
    return toReturn();
  }

  @Override
  public T virtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
    return toReturn();
  }

  @Override
  public T connectionTimeout(Duration timeout) {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("Connection timeout must be positive");
    }
    this.connectionTimeout = timeout;
    return toReturn();
  }

  String host() {
    return this.host;
  }

  int port() {
    return this.port;
  }

  String username() {
    return this.username;
  }

  String password() {
    return this.password;
  }

  String virtualHost() {
    return this.virtualHost;
  }

  Duration connectionTimeout() {
    return this.connectionTimeout;
  }

  abstract T toReturn();

  DefaultConnectionSettings<?> consolidate() {
    if (this.uri != null) {
      String host = uri.getHost();
      if (host != null) {
        this.host(host);
      }

      int port = uri.getPort();
      if (port != -1) {
        this.port(port);
      }

      String userInfo = uri.getRawUserInfo();
      if (userInfo != null) {
        String[] userPassword = userInfo.split(":");
        if (userPassword.length > 2) {
          throw new IllegalArgumentException("Bad user info in URI " + userInfo);
        }

        this.username(uriDecode(userPassword[0]));
        if (userPassword.length == 2) {
          this.password(uriDecode(userPassword[1]));
        }
      }

      String path = uri.getRawPath();
      if (path != null && !path.isEmpty()) {
        if (path.indexOf('/', 1) != -1) {
          throw new IllegalArgumentException("Multiple segments in path of URI: " + path);
        }
        this.virtualHost(uriDecode(uri.getRawPath().substring(1)));
      }
    }
    return this;
  }

  static DefaultConnectionSettings<?> instance() {
    return new DefaultConnectionSettings<>() {
      @Override
      Object toReturn() {
        return null;
      }
    };
  }

  private static URI toUri(String uriString) {
    try {
      URI uri = new URI(uriString);
      if (!"amqp".equalsIgnoreCase(uri.getScheme())) {
        throw new IllegalArgumentException(
            "Wrong scheme in AMQP URI: " + uri.getScheme() + ". Should be amqp");
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid URI: " + uriString, e);
    }
  }

  private static String uriDecode(String s) {
    try {
      // URLDecode decodes '+' to a space, as for
      // form encoding. So protect plus signs.
      return URLDecoder.decode(s.replace("+", "%2B"), "US-ASCII");
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
