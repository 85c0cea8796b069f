package com.delta.listener.signal.source;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.http.HttpTransport;
import com.delta.listener.signal.http.ResilientHttpClient;
import com.delta.listener.signal.http.RetryInterceptor;
import com.delta.listener.signal.model.GitHubCompany;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class GitHubProfileClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private GitHubProfileClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);

        ListenerProperties properties = new ListenerProperties();
        properties.getGithub().setApiBaseUrl(server.url("/").toString().replaceAll("/$", ""));
        ResilientHttpClient httpClient = new ResilientHttpClient(
            properties,
            new HttpTransport(properties, executor),
            List.of(new RetryInterceptor(millis -> {
            }))
        );
        client = new GitHubProfileClient(properties, httpClient, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void companyHandleIsStrippedAndGuessed() throws Exception {
        server.enqueue(new MockResponse()
            .setBody("{\"login\":\"dana\",\"company\":\"@Gate Keep\"}")
            .setHeader("Content-Type", "application/json"));

        GitHubCompany company = client.fetchCompany("dana");

        assertEquals("Gate Keep", company.company());
        assertEquals("gatekeep.com", company.guessedDomain());
        RecordedRequest request = server.takeRequest();
        assertEquals("/users/dana", request.getPath());
        assertEquals("application/vnd.github+json", request.getHeader("Accept"));
    }

    @Test
    void emptyCompanyAndMissingUserYieldNothing() {
        server.enqueue(new MockResponse().setBody("{\"login\":\"quiet\",\"company\":null}"));
        server.enqueue(new MockResponse().setResponseCode(404));

        assertNull(client.fetchCompany("quiet"));
        assertNull(client.fetchCompany("ghost"));
        assertNull(client.fetchCompany(" "));
    }

    @Test
    void malformedPayloadYieldsNothing() {
        server.enqueue(new MockResponse().setBody("{not json"));

        assertNull(client.fetchCompany("broken"));
    }
}
