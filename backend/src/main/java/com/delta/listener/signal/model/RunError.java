package com.delta.listener.signal.model;

import java.time.Instant;

public record RunError(String message, Instant timestamp) {}
