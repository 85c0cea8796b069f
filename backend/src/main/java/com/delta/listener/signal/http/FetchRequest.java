package com.delta.listener.signal.http;

import java.net.URI;

public record FetchRequest(
    String url,
    URI uri,
    FetchOptions options,
    int attempt,
    URI proxy
) {
    public FetchRequest withAttempt(int nextAttempt) {
        return new FetchRequest(url, uri, options, nextAttempt, proxy);
    }

    public FetchRequest withProxy(URI nextProxy) {
        return new FetchRequest(url, uri, options, attempt, nextProxy);
    }

    public String host() {
        return uri == null ? null : uri.getHost();
    }
}
