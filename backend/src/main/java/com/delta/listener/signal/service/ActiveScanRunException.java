package com.delta.listener.signal.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveScanRunException extends RuntimeException {
    public ActiveScanRunException(String message) {
        super(message);
    }
}
