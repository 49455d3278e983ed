package com.verlumen.marketpipe.http;

import java.io.IOException;

/** A request completed at the HTTP level but with a non-success status code. */
public final class HttpStatusException extends IOException {
    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    /** 429 and 5xx responses are worth retrying. */
    public boolean isRetryable() {
        return statusCode == 429 || statusCode >= 500;
    }
}
