package com.delta.listener.signal.keywords;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class KeywordNotFoundException extends RuntimeException {
    public KeywordNotFoundException(long id) {
        super("Keyword " + id + " not found");
    }
}
