package com.delta.listener.signal.http;

import com.delta.listener.signal.model.HttpFetchResult;

/**
 * One concern of the outbound fetch pipeline. Implementations either answer the request themselves or
 * hand it to the rest of the chain, and never throw for transport failures: those travel as error codes
 * on the returned {@link HttpFetchResult}.
 */
public interface FetchInterceptor {
    HttpFetchResult intercept(FetchRequest request, FetchChain chain);
}
