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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.vibebot.consumer.ConsumerException.MessageDecodingException;
import com.vibebot.consumer.MessageCodec;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;

/**
 * {@link MessageCodec} backed by Gson.
 *
 * <p>The body must be UTF-8 and contain exactly one JSON value. Parsing is strict: comments,
 * unquoted names and trailing content are rejected.
 */
public class GsonMessageCodec implements MessageCodec {

  private static final Gson GSON = new Gson();
  private static final TypeAdapter<JsonElement> JSON_ELEMENT_ADAPTER =
      GSON.getAdapter(JsonElement.class);

  @Override
  public JsonElement decode(byte[] body) {
    if (body == null || body.length == 0) {
      throw new MessageDecodingException("Message body is empty", null);
    }
    String json = utf8(body);
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(false);
      JsonElement element = JSON_ELEMENT_ADAPTER.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new MessageDecodingException("Unexpected content after JSON document", null);
      }
      return element;
    } catch (IOException | JsonParseException | IllegalStateException e) {
      throw new MessageDecodingException("Message body is not valid JSON: " + e.getMessage(), e);
    }
  }

  private static String utf8(byte[] body) {
    try {
      return UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(body))
          .toString();
    } catch (CharacterCodingException e) {
      throw new MessageDecodingException("Message body is not valid UTF-8", e);
    }
  }
}
