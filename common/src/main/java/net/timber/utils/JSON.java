// This file is part of Timber.
// Copyright (C) 2026  The Timber Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.timber.utils;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;

import net.timber.data.NanoTimeStamp;
import net.timber.data.TimeStamp;

/**
 * This class simply provides a static initialization and configuration of the
 * Jackson ObjectMapper for use throughout Timber. Since the mapper takes a
 * fair amount of construction and is thread safe, the Jackson docs recommend
 * initializing it once per app.
 * <p>
 * Timestamps are written as fractional epoch seconds with up to nine
 * decimals and read back without loss.
 * <p>
 * Jackson's typed exceptions are wrapped: mapping and parse failures become
 * {@link IllegalArgumentException}s, anything else a {@link JSONException}.
 * @since 1.0
 */
public final class JSON {
  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    // non-finite statistics are legal output.
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    final SimpleModule module = new SimpleModule("TimberTimeStamps");
    module.addSerializer(TimeStamp.class, new TimeStampSerializer());
    module.addDeserializer(TimeStamp.class, new TimeStampDeserializer());
    jsonMapper.registerModule(module);
  }

  private JSON() {
  }

  /**
   * Deserializes a JSON formatted string to a specific class type
   * @param json The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @throws JSONException if the data could not be parsed
   */
  public static final <T> T parseToObject(final String json,
      final Class<T> pojo) {
    if (json == null || json.isEmpty())
      throw new IllegalArgumentException("Incoming data was null or empty");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");

    try {
      return jsonMapper.readValue(json, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Deserializes a JSON formatted string to a specific class type
   * @param json The string to deserialize
   * @param type A type definition for a complex object
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or type was null or parsing
   * failed
   * @throws JSONException if the data could not be parsed
   */
  public static final <T> T parseToObject(final String json,
      final TypeReference<T> type) {
    if (json == null || json.isEmpty())
      throw new IllegalArgumentException("Incoming data was null or empty");
    if (type == null)
      throw new IllegalArgumentException("Missing type reference");

    try {
      return jsonMapper.readValue(json, type);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Serializes the given object to a JSON string
   * @param object The object to serialize
   * @return A JSON formatted string
   * @throws IllegalArgumentException if the object was null
   * @throws JSONException if the object could not be serialized
   */
  public static final String serializeToString(final Object object) {
    if (object == null)
      throw new IllegalArgumentException("Object was null");
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }

  /** Writes a timestamp as exact fractional epoch seconds. */
  static class TimeStampSerializer extends JsonSerializer<TimeStamp> {
    @Override
    public void serialize(final TimeStamp value,
                          final JsonGenerator gen,
                          final SerializerProvider serializers) throws IOException {
      gen.writeNumber(BigDecimal.valueOf(value.epoch())
          .add(BigDecimal.valueOf(value.nanos(), 9))
          .stripTrailingZeros()
          .toPlainString());
    }
  }

  /** Reads fractional epoch seconds without going through a double. */
  static class TimeStampDeserializer extends JsonDeserializer<TimeStamp> {
    @Override
    public TimeStamp deserialize(final JsonParser parser,
                                 final DeserializationContext context)
        throws IOException {
      final JsonToken token = parser.currentToken();
      if (token != JsonToken.VALUE_NUMBER_INT
          && token != JsonToken.VALUE_NUMBER_FLOAT) {
        return (TimeStamp) context.handleUnexpectedToken(TimeStamp.class, parser);
      }
      final BigDecimal value = parser.getDecimalValue();
      final BigDecimal seconds = value.setScale(0, RoundingMode.FLOOR);
      final long nanos = value.subtract(seconds).movePointRight(9).longValue();
      return new NanoTimeStamp(seconds.longValueExact(), nanos);
    }
  }
}
