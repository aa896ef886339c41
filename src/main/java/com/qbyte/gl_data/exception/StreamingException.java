package com.qbyte.gl_data.exception;

import java.util.Map;

/**
 * A stream session failed for a reason unrelated to client input,
 * e.g. a frame could not be encoded. Ends that session only.
 */
public class StreamingException extends GlDataServiceException {

    public StreamingException(String message, String sessionId, Throwable cause) {
        super(message, Map.of("sessionId", sessionId), cause);
    }
}
