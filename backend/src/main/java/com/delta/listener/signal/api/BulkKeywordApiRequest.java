package com.delta.listener.signal.api;

import java.util.List;

public record BulkKeywordApiRequest(List<KeywordApiRequest> keywords) {
}
