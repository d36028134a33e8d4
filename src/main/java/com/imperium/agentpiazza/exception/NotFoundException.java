package com.imperium.agentpiazza.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class NotFoundException extends ApiException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "not_found", message);
    }

    public NotFoundException(String message, String hint) {
        super(HttpStatus.NOT_FOUND, "not_found", message, Map.of("hint", hint));
    }
}
