package com.delta.listener.signal.http;

import com.delta.listener.signal.model.HttpFetchResult;

import java.net.URI;

public class ProxyRotationInterceptor implements FetchInterceptor {
    private final ProxyRotator rotator;

    public ProxyRotationInterceptor(ProxyRotator rotator) {
        this.rotator = rotator;
    }

    @Override
    public HttpFetchResult intercept(FetchRequest request, FetchChain chain) {
        if (rotator == null || !rotator.hasProxies()) {
            return chain.proceed(request);
        }
        URI proxy = rotator.current();
        HttpFetchResult result = chain.proceed(request.withProxy(proxy));
        if (result.isRateLimited()) {
            rotator.quarantine(proxy);
            rotator.rotate();
        }
        return result;
    }
}
