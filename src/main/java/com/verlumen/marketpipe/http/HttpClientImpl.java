package com.verlumen.marketpipe.http;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.util.Map;

final class HttpClientImpl implements HttpClient {
    private static final FluentLogger logger = FluentLogger.forEnclosingClass();
    private final HttpURLConnectionFactory httpURLConnectionFactory;

    @Inject
    HttpClientImpl(HttpURLConnectionFactory httpURLConnectionFactory) {
        this.httpURLConnectionFactory = httpURLConnectionFactory;
    }

    @Override
    public String get(String url, Map<String, String> headers) throws IOException {
        return execute("GET", url, headers, null);
    }

    @Override
    public String postJson(String url, Map<String, String> headers, String body) throws IOException {
        return execute("POST", url, headers, body);
    }

    private String execute(String method, String url, Map<String, String> headers, String body)
            throws IOException {
        logger.atFine().log("Making %s request to URL: %s", method, url);

        HttpURLConnection con = null;
        try {
            con = httpURLConnectionFactory.create(url);
            con.setRequestMethod(method);

            for (Map.Entry<String, String> header : headers.entrySet()) {
                con.setRequestProperty(header.getKey(), header.getValue());
            }

            if (body != null) {
                con.setDoOutput(true);
                con.setRequestProperty("Content-Type", "application/json");
                try (OutputStream out = con.getOutputStream()) {
                    out.write(body.getBytes(StandardCharsets.UTF_8));
                }
            }

            int responseCode = con.getResponseCode();
            logger.atFine().log("Received response code %d from %s", responseCode, url);

            if (responseCode != HttpURLConnection.HTTP_OK) {
                String errorMessage = String.format("Failed to fetch data: HTTP code %d", responseCode);
                throw new HttpStatusException(responseCode, errorMessage);
            }

            String response = readFully(con);
            logger.atFine().log("Response length: %d characters", response.length());
            return response;
        } catch (IOException e) {
            logger.atWarning().withCause(e).log("Failed to execute %s request to %s", method, url);
            throw e;
        } finally {
            if (con != null) {
                con.disconnect();
            }
        }
    }

    private static String readFully(HttpURLConnection con) throws IOException {
        StringBuilder responseStrBuilder = new StringBuilder();
        try (BufferedReader in =
                new BufferedReader(new InputStreamReader(con.getInputStream(), StandardCharsets.UTF_8))) {
            String inputLine;
            while ((inputLine = in.readLine()) != null) {
                responseStrBuilder.append(inputLine);
            }
        }
        return responseStrBuilder.toString();
    }
}
