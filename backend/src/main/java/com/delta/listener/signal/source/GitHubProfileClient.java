package com.delta.listener.signal.source;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.http.FetchOptions;
import com.delta.listener.signal.http.ResilientHttpClient;
import com.delta.listener.signal.model.GitHubCompany;
import com.delta.listener.signal.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Reads the public {@code company} field of a GitHub account, used to cross-check an employer guessed from a bio.
 */
@Service
public class GitHubProfileClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubProfileClient.class);

    private final ListenerProperties properties;
    private final ResilientHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubProfileClient(ListenerProperties properties, ResilientHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public GitHubCompany fetchCompany(String username) {
        if (username == null || username.isBlank()) {
            return null;
        }
        String url = properties.getGithub().getApiBaseUrl() + "/users/" + URLEncoder.encode(username, StandardCharsets.UTF_8);
        FetchOptions options = httpClient.options(properties.getGithub().getTimeoutMs(), 0)
            .withAccept("application/vnd.github+json");
        HttpFetchResult result = httpClient.fetch(url, options);
        if (!result.isSuccessful()) {
            log.debug("GitHub lookup for {} failed: status={}, error={}", username, result.statusCode(), result.errorCode());
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(result.body());
            String company = node.path("company").asText("").trim();
            if (company.startsWith("@")) {
                company = company.substring(1).trim();
            }
            if (company.isEmpty()) {
                return null;
            }
            return new GitHubCompany(username, company, guessDomain(company));
        } catch (JsonProcessingException e) {
            log.warn("Malformed GitHub payload for {}: {}", username, e.getOriginalMessage());
            return null;
        }
    }

    static String guessDomain(String company) {
        String squashed = company.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        return squashed.isEmpty() ? null : squashed + ".com";
    }
}
