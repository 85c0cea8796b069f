package com.delta.listener.signal.api;

public record CategoryWeightApiRequest(Integer weight) {
}
