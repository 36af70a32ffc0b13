// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.ossert.common.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Map;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.primitives.Longs;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import com.ossert.common.stats.MetricsContainer;
import com.ossert.common.stats.MetricsSchema;
import com.ossert.common.stats.QuarterStore;
import com.ossert.common.util.Clock;

/**
 * A {@link Codec} for the JSON form of a {@link QuarterStore}, see
 * {@link QuarterStore#toJsonTree()}.
 *
 * <p>Integral numbers are decoded as {@link Long}s, all others as {@link Double}s.  NaN and
 * infinite metrics have no JSON form and fail serialization.
 *
 * @param <T> The metrics container type of the stores.
 */
public class JsonQuarterStoreCodec<T extends MetricsContainer> implements Codec<QuarterStore<T>> {

  private final MetricsSchema<T> schema;
  private final Clock clock;
  private final Gson gson = new Gson();

  public static <T extends MetricsContainer> JsonQuarterStoreCodec<T> create(
      MetricsSchema<T> schema) {
    return new JsonQuarterStoreCodec<T>(schema, Clock.SYSTEM_CLOCK);
  }

  /**
   * @param schema Rebuilds the containers of decoded stores.
   * @param clock Clock handed to decoded stores.
   */
  public JsonQuarterStoreCodec(MetricsSchema<T> schema, Clock clock) {
    this.schema = Preconditions.checkNotNull(schema);
    this.clock = Preconditions.checkNotNull(clock);
  }

  @Override
  public void serialize(QuarterStore<T> store, OutputStream sink) throws IOException {
    Preconditions.checkNotNull(store);
    Preconditions.checkNotNull(sink);
    JsonObject document;
    try {
      document = store.toJsonTree();
    } catch (IllegalStateException e) {
      throw new IOException("Quarters can not be represented as JSON", e);
    }
    Writer writer = new OutputStreamWriter(sink, Charsets.UTF_8);
    try {
      gson.toJson(document, writer);
    } catch (JsonIOException e) {
      throw new IOException("Problem serializing quarters: " + store, e);
    }
    writer.flush();
  }

  @Override
  public QuarterStore<T> deserialize(InputStream source) throws IOException {
    Preconditions.checkNotNull(source);
    JsonElement document;
    try {
      document = JsonParser.parseReader(new InputStreamReader(source, Charsets.UTF_8));
    } catch (JsonParseException e) {
      throw new IOException("Problem parsing quarters JSON", e);
    }
    if (!document.isJsonObject()) {
      throw new IOException("Expected a JSON object of quarters, got: " + document);
    }

    QuarterStore<T> store = new QuarterStore<T>(schema, clock);
    for (Map.Entry<String, JsonElement> entry : document.getAsJsonObject().entrySet()) {
      Long quarterStart = Longs.tryParse(entry.getKey());
      if (quarterStart == null) {
        throw new IOException("Quarter key is not a timestamp: " + entry.getKey());
      }
      if (!entry.getValue().isJsonObject()) {
        throw new IOException("Quarter " + quarterStart + " is not a JSON object");
      }
      T quarter = restore(quarterStart, entry.getValue());
      try {
        store.insert(quarterStart, quarter);
      } catch (IllegalArgumentException e) {
        throw new IOException("Invalid quarter " + quarterStart, e);
      } catch (IllegalStateException e) {
        throw new IOException("Duplicate quarter " + quarterStart, e);
      }
    }
    return store;
  }

  /**
   * Decodes a store from its string form.
   *
   * @throws IOException if {@code json} does not hold a valid store.
   */
  public QuarterStore<T> fromJson(String json) throws IOException {
    Preconditions.checkNotNull(json);
    return deserialize(new ByteArrayInputStream(json.getBytes(Charsets.UTF_8)));
  }

  private T restore(long quarterStart, JsonElement quarter) throws IOException {
    Map<String, Number> values = Maps.newLinkedHashMap();
    for (Map.Entry<String, JsonElement> metric : quarter.getAsJsonObject().entrySet()) {
      JsonElement value = metric.getValue();
      if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
        throw new IOException(String.format("Metric %s of quarter %d is not a number: %s",
            metric.getKey(), quarterStart, value));
      }
      values.put(metric.getKey(), toNumber(value.getAsJsonPrimitive()));
    }
    try {
      return schema.restore(values);
    } catch (IllegalArgumentException e) {
      throw new IOException("Quarter " + quarterStart + " does not match the schema", e);
    }
  }

  private static Number toNumber(JsonPrimitive primitive) {
    String text = primitive.getAsString();
    Long integral = Longs.tryParse(text);
    if (integral != null) {
      return integral;
    }
    return Double.valueOf(text);
  }
}
