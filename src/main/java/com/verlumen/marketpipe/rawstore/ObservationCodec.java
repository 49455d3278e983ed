package com.verlumen.marketpipe.rawstore;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.verlumen.marketpipe.instruments.AssetClass;
import com.verlumen.marketpipe.instruments.Instrument;
import com.verlumen.marketpipe.marketdata.Observation;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of raw segments. Field order is fixed, so equal observations always encode to
 * equal bytes.
 */
final class ObservationCodec {
  private static final Gson GSON = new GsonBuilder().serializeSpecialFloatingPointValues().create();

  static byte[] encode(List<Observation> observations) {
    JsonArray array = new JsonArray();
    observations.stream().map(ObservationCodec::toJson).forEach(array::add);
    return GSON.toJson(array).getBytes(StandardCharsets.UTF_8);
  }

  static ImmutableList<Observation> decode(byte[] bytes) {
    JsonArray array = JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8)).getAsJsonArray();
    return array.asList().stream()
        .map(JsonElement::getAsJsonObject)
        .map(ObservationCodec::fromJson)
        .collect(toImmutableList());
  }

  private static JsonObject toJson(Observation observation) {
    JsonObject json = new JsonObject();
    json.addProperty("symbol", observation.instrument().symbol());
    json.addProperty("assetClass", observation.instrument().assetClass().name());
    json.addProperty("venue", observation.instrument().venue());
    json.addProperty("timestamp", observation.timestamp().toString());
    json.addProperty("open", observation.open());
    json.addProperty("high", observation.high());
    json.addProperty("low", observation.low());
    json.addProperty("close", observation.close());
    json.addProperty("volume", observation.volume());
    json.addProperty("source", observation.source());
    observation.ingestionId().ifPresent(id -> json.addProperty("ingestionId", id));
    json.addProperty("revision", observation.revision());
    JsonObject attributes = new JsonObject();
    observation.attributes().forEach(attributes::addProperty);
    json.add("attributes", attributes);
    return json;
  }

  private static Observation fromJson(JsonObject json) {
    ImmutableSortedMap.Builder<String, Double> attributes = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<String, JsonElement> attribute : json.getAsJsonObject("attributes").entrySet()) {
      attributes.put(attribute.getKey(), attribute.getValue().getAsDouble());
    }
    Observation.Builder builder =
        Observation.builder()
            .setInstrument(
                Instrument.create(
                    json.get("symbol").getAsString(),
                    AssetClass.valueOf(json.get("assetClass").getAsString()),
                    json.get("venue").getAsString()))
            .setTimestamp(Instant.parse(json.get("timestamp").getAsString()))
            .setOpen(json.get("open").getAsDouble())
            .setHigh(json.get("high").getAsDouble())
            .setLow(json.get("low").getAsDouble())
            .setClose(json.get("close").getAsDouble())
            .setVolume(json.get("volume").getAsDouble())
            .setSource(json.get("source").getAsString())
            .setRevision(json.get("revision").getAsInt())
            .setAttributes(attributes.buildOrThrow());
    if (json.has("ingestionId")) {
      builder.setIngestionId(json.get("ingestionId").getAsString());
    }
    return builder.build();
  }

  private ObservationCodec() {}
}
