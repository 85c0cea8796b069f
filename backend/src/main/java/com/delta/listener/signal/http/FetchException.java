package com.delta.listener.signal.http;

import com.delta.listener.signal.model.HttpFetchResult;

public class FetchException extends RuntimeException {
    private final String url;
    private final int statusCode;
    private final String errorCode;

    public FetchException(HttpFetchResult result) {
        super(describe(result));
        this.url = result.requestedUrl();
        this.statusCode = result.statusCode();
        this.errorCode = result.errorCode();
    }

    public String getUrl() {
        return url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    private static String describe(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return "Fetch failed for " + result.requestedUrl() + ": " + result.errorCode()
                + (result.errorMessage() == null ? "" : " (" + result.errorMessage() + ")");
        }
        return "Fetch failed for " + result.requestedUrl() + ": HTTP " + result.statusCode();
    }
}
