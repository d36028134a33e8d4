package com.imperium.agentpiazza.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class ConflictException extends ApiException {

    public ConflictException(String message, String hint) {
        super(HttpStatus.CONFLICT, "conflict", message, Map.of("hint", hint));
    }
}
