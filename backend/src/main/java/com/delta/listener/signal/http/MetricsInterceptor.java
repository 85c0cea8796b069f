package com.delta.listener.signal.http;

import com.delta.listener.signal.metrics.ScanMetrics;
import com.delta.listener.signal.model.HttpFetchResult;
import io.micrometer.core.instrument.Timer;

/**
 * Outermost interceptor: times each logical fetch, retries and rate-limit waits included.
 */
public class MetricsInterceptor implements FetchInterceptor {
    private final ScanMetrics metrics;

    public MetricsInterceptor(ScanMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public HttpFetchResult intercept(FetchRequest request, FetchChain chain) {
        Timer.Sample sample = metrics.startFetch();
        HttpFetchResult result = chain.proceed(request);
        metrics.stopFetch(sample, outcome(result));
        return result;
    }

    static String outcome(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return "failure";
        }
        return result.isSuccessful() ? "success" : "http_error";
    }
}
