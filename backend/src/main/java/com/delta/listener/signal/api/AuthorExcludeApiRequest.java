package com.delta.listener.signal.api;

public record AuthorExcludeApiRequest(String reason) {
}
