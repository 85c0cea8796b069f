package com.delta.listener.signal.http;

import com.delta.listener.signal.model.HttpFetchResult;

@FunctionalInterface
public interface FetchChain {
    HttpFetchResult proceed(FetchRequest request);
}
