package com.example.demo.factfind.render;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * HTML that has been through the allow-list and can be inserted into a page as is.
 */
@Value
public class SafeHtml {
    private static final SafeHtml EMPTY = new SafeHtml("");

    String html;

    public static SafeHtml empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return html.isEmpty();
    }
}
