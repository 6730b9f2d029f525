package com.example.demo.factfind.exception;

import lombok.Getter;

/**
 * The generation request failed in transport or was answered with a non-2xx status.
 * {@code status} is null when no response was received.
 */
@Getter
public class GenerationTransportException extends RuntimeException {
    private final String code;
    private final Integer status;

    public GenerationTransportException(String code, String message, Integer status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
