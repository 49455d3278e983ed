package com.verlumen.marketpipe.signals;

import java.util.Optional;

/**
 * @param modelEndpoint HTTP endpoint of the prediction model; the built-in heuristic when empty
 */
public record SignalsConfig(
    double buyThreshold,
    double sellThreshold,
    String signalTopic,
    Optional<String> modelEndpoint,
    String modelVersion) {}
