package com.example.demo.factfind.exception;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends RuntimeException {
    public static final String CODE = "SESSION_NOT_FOUND";

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super(CODE + ": No form session with id '" + sessionId + "'");
        this.sessionId = sessionId;
    }

    public String getCode() {
        return CODE;
    }

    public String getDescription() {
        return "No form session with id '" + sessionId + "'";
    }
}
