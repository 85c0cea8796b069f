package com.delta.listener.signal.model;

import java.util.List;

public record DiscoveryPage(List<Discovery> discoveries, long total, int limit, int offset) {}
