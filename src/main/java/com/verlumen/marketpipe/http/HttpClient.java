package com.verlumen.marketpipe.http;

import java.io.IOException;
import java.util.Map;

public interface HttpClient {
    /**
     * Issues a GET request and returns the body.
     *
     * @throws HttpStatusException if the server answers with a non-200 status
     * @throws IOException on connection, timeout or read failures
     */
    String get(String url, Map<String, String> headers) throws IOException;

    /** Issues a POST request with a JSON body and returns the response body. */
    String postJson(String url, Map<String, String> headers, String body) throws IOException;
}
