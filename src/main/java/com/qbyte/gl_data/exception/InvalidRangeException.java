package com.qbyte.gl_data.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client supplied a malformed or inconsistent query range.
 * The offending parameters and their raw values are kept in {@link #getDetails()}.
 */
public class InvalidRangeException extends GlDataServiceException {

    public InvalidRangeException(String message, Map<String, String> details) {
        super(message, details);
    }

    public static InvalidRangeException forField(String message, String field, String value) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put(field, value != null ? value : "null");
        return new InvalidRangeException(message, details);
    }
}
