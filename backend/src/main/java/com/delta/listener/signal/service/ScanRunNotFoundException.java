package com.delta.listener.signal.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ScanRunNotFoundException extends RuntimeException {
    public ScanRunNotFoundException(long id) {
        super("Scan run " + id + " not found");
    }
}
