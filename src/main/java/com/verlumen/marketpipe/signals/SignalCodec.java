package com.verlumen.marketpipe.signals;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.verlumen.marketpipe.instruments.Instrument;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/** JSON form of a signal, shared by the log and the Kafka publisher. */
final class SignalCodec {
  static String toJson(Signal signal) {
    JsonObject json = new JsonObject();
    json.addProperty("symbol", signal.instrument().symbol());
    json.addProperty("assetClass", signal.instrument().assetClass().name());
    json.addProperty("venue", signal.instrument().venue());
    json.addProperty("timestamp", signal.timestamp().toString());
    json.addProperty("decision", signal.decision().name());
    json.addProperty("confidence", signal.confidence());
    json.addProperty("expectedReturn", signal.expectedReturn());
    json.addProperty("featureSetVersion", signal.featureSetVersion());
    json.addProperty("modelVersion", signal.modelVersion());
    return json.toString();
  }

  static byte[] encode(Signal signal) {
    return toJson(signal).getBytes(StandardCharsets.UTF_8);
  }

  static Signal decode(Instrument instrument, byte[] bytes) {
    JsonObject json =
        JsonParser.parseString(new String(bytes, StandardCharsets.UTF_8)).getAsJsonObject();
    return Signal.builder()
        .setInstrument(instrument)
        .setTimestamp(Instant.parse(json.get("timestamp").getAsString()))
        .setDecision(Decision.valueOf(json.get("decision").getAsString()))
        .setConfidence(json.get("confidence").getAsDouble())
        .setExpectedReturn(json.get("expectedReturn").getAsDouble())
        .setFeatureSetVersion(json.get("featureSetVersion").getAsString())
        .setModelVersion(json.get("modelVersion").getAsString())
        .build();
  }

  private SignalCodec() {}
}
