package com.delta.listener.signal.model;

public record ProspectSeed(String companyName, String source, Long discoveryId, String notes) {}
