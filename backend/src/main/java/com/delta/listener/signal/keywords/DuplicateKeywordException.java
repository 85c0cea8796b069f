package com.delta.listener.signal.keywords;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateKeywordException extends RuntimeException {
    public DuplicateKeywordException(String keyword) {
        super("Keyword \"" + keyword + "\" already exists");
    }
}
