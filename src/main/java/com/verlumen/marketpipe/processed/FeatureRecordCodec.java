package com.verlumen.marketpipe.processed;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.verlumen.marketpipe.features.FeatureRecord;
import com.verlumen.marketpipe.instruments.Instrument;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/** One partition of feature records as JSON. Instrument and version come from the partition key. */
final class FeatureRecordCodec {
  private static final Gson GSON = new Gson();

  static byte[] encode(Collection<FeatureRecord> records) {
    JsonArray array = new JsonArray();
    for (FeatureRecord record : records) {
      JsonObject json = new JsonObject();
      json.addProperty("timestamp", record.timestamp().toString());
      JsonObject values = new JsonObject();
      record.values().forEach(values::addProperty);
      json.add("values", values);
      array.add(json);
    }
    return GSON.toJson(array).getBytes(StandardCharsets.UTF_8);
  }

  static ImmutableList<FeatureRecord> decode(Instrument instrument, String version, byte[] bytes) {
    JsonArray array = JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8)).getAsJsonArray();
    return array.asList().stream()
        .map(JsonElement::getAsJsonObject)
        .map(json -> fromJson(instrument, version, json))
        .collect(toImmutableList());
  }

  private static FeatureRecord fromJson(Instrument instrument, String version, JsonObject json) {
    ImmutableSortedMap.Builder<String, Double> values = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<String, JsonElement> value : json.getAsJsonObject("values").entrySet()) {
      values.put(value.getKey(), value.getValue().getAsDouble());
    }
    return FeatureRecord.create(
        instrument, Instant.parse(json.get("timestamp").getAsString()), version, values.buildOrThrow());
  }

  private FeatureRecordCodec() {}
}
