package com.delta.listener.signal.model;

public record GitHubCompany(String username, String company, String guessedDomain) {}
