package com.delta.listener.signal.model;

public enum HnStoryList {
    TOP("topstories"),
    NEW("newstories"),
    BEST("beststories"),
    ASK("askstories"),
    SHOW("showstories");

    private final String path;

    HnStoryList(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
