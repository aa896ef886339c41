package com.qbyte.gl_data.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for the GL data service.
 * Carries a details map that is echoed back to the client.
 */
public class GlDataServiceException extends RuntimeException {

    private final Map<String, String> details;

    public GlDataServiceException(String message) {
        this(message, Map.of());
    }

    public GlDataServiceException(String message, Map<String, String> details) {
        super(message);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public GlDataServiceException(String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
