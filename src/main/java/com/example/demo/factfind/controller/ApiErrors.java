package com.example.demo.factfind.controller;

import com.example.demo.factfind.client.TemplateListingClient;
import com.example.demo.factfind.exception.FormValidationException;
import com.example.demo.factfind.exception.SessionNotFoundException;
import com.example.demo.factfind.exception.TemplateNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps error codes to HTTP responses with a {@code {code, description}} body.
 */
final class ApiErrors {
    private static final Set<String> BAD_REQUEST_CODES = Set.of(
            FormValidationException.NO_TEMPLATE_SELECTED,
            FormValidationException.UNKNOWN_FIELD,
            FormValidationException.READ_ONLY_FIELD,
            FormValidationException.INVALID_VALUE,
            FormValidationException.UNKNOWN_ITEM);

    private ApiErrors() {
    }

    static ResponseEntity<Map<String, String>> toResponse(String code, String description) {
        Map<String, String> body = new HashMap<>();
        body.put("code", code);
        body.put("description", description);

        if (TemplateNotFoundException.CODE.equals(code) || SessionNotFoundException.CODE.equals(code)) {
            return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
        } else if (BAD_REQUEST_CODES.contains(code)) {
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        } else if (TemplateListingClient.LISTING_UNAVAILABLE.equals(code)) {
            return new ResponseEntity<>(body, HttpStatus.BAD_GATEWAY);
        }
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
