package com.delta.listener.signal.http;

import com.delta.listener.config.ListenerProperties;
import com.delta.listener.signal.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Last link of the fetch chain: performs exactly one HTTP GET, directly or through the proxy chosen
 * upstream, and turns every transport failure into an error-coded result.
 */
@Component
public class HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);

    private final ListenerProperties properties;
    private final ExecutorService httpExecutor;
    private final HttpClient directClient;
    private final Map<URI, HttpClient> proxyClients = new ConcurrentHashMap<>();

    public HttpTransport(ListenerProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.httpExecutor = httpExecutor;
        this.directClient = newClient(null);
    }

    public HttpFetchResult execute(FetchRequest request) {
        Instant startedAt = Instant.now();
        if (request.uri() == null || request.uri().getHost() == null) {
            return HttpFetchResult.error(request.url(), startedAt, "invalid_url", "URL missing host or malformed");
        }
        HttpClient client = request.proxy() == null
            ? directClient
            : proxyClients.computeIfAbsent(request.proxy(), this::newClient);
        HttpRequest httpRequest = HttpRequest.newBuilder(request.uri())
            .timeout(request.options().timeout())
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", request.options().accept())
            .header("Accept-Language", "en-US,en;q=0.8")
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            HttpFetchResult result = new HttpFetchResult(
                request.url(),
                response.uri(),
                response.statusCode(),
                bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
            log.debug("GET {} -> {} in {} ms", request.url(), result.statusCode(), result.duration().toMillis());
            return result;
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.error(request.url(), startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return HttpFetchResult.error(request.url(), startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.error(request.url(), startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return HttpFetchResult.error(request.url(), startedAt, "invalid_url", e.getMessage());
        }
    }

    private HttpClient newClient(URI proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(properties.getHttp().getRequestTimeoutMs()))
            .version(HttpClient.Version.HTTP_1_1);
        if (httpExecutor != null) {
            builder.executor(httpExecutor);
        }
        if (proxy != null) {
            builder.proxy(ProxySelector.of(new InetSocketAddress(proxy.getHost(), proxy.getPort())));
        }
        return builder.build();
    }
}
