package com.verlumen.marketpipe.signals;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.marketpipe.features.FeatureRecord;
import com.verlumen.marketpipe.http.HttpClient;
import com.verlumen.marketpipe.http.HttpStatusException;
import java.io.IOException;

/**
 * A model served over HTTP. Posts the feature record as JSON and expects
 * {@code {"expectedReturn": <double>, "confidence": <double>}} back.
 */
final class RemotePredictionModel implements PredictionModel {
  private static final ImmutableMap<String, String> HEADERS =
      ImmutableMap.of("Accept", "application/json");

  private final HttpClient httpClient;
  private final String endpoint;
  private final String modelVersion;

  RemotePredictionModel(HttpClient httpClient, String endpoint, String modelVersion) {
    this.httpClient = httpClient;
    this.endpoint = endpoint;
    this.modelVersion = modelVersion;
  }

  @Override
  public String modelVersion() {
    return modelVersion;
  }

  @Override
  public Prediction predict(FeatureRecord record)
      throws ModelUnavailableException, ModelInferenceException {
    String response;
    try {
      response = httpClient.postJson(endpoint, HEADERS, toRequest(record).toString());
    } catch (HttpStatusException e) {
      if (e.isRetryable()) {
        throw new ModelUnavailableException("Model endpoint answered HTTP " + e.statusCode(), e);
      }
      throw new ModelInferenceException("Model rejected record with HTTP " + e.statusCode(), e);
    } catch (IOException e) {
      throw new ModelUnavailableException("Model endpoint unreachable: " + endpoint, e);
    }

    try {
      JsonObject json = JsonParser.parseString(response).getAsJsonObject();
      if (!json.has("expectedReturn") || !json.has("confidence")) {
        throw new ModelInferenceException("Incomplete model response: " + response);
      }
      return Prediction.create(
          json.get("expectedReturn").getAsDouble(), json.get("confidence").getAsDouble());
    } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
      throw new ModelInferenceException("Malformed model response: " + response, e);
    }
  }

  private JsonObject toRequest(FeatureRecord record) {
    JsonObject request = new JsonObject();
    request.addProperty("modelVersion", modelVersion);
    request.addProperty("symbol", record.instrument().symbol());
    request.addProperty("timestamp", record.timestamp().toString());
    request.addProperty("featureSetVersion", record.featureSetVersion());
    JsonObject features = new JsonObject();
    record.values().forEach(features::addProperty);
    request.add("features", features);
    return request;
  }
}
