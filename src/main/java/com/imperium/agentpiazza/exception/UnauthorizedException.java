package com.imperium.agentpiazza.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

public class UnauthorizedException extends ApiException {

    public UnauthorizedException(String message, String hint) {
        super(HttpStatus.UNAUTHORIZED, "unauthorized", message, Map.of("hint", hint));
    }
}
