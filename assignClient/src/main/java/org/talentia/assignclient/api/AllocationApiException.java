package org.talentia.assignclient.api;

import java.util.Collections;
import java.util.Map;

/**
 * Raised when the engine rejects a call or cannot be reached.
 */
public class AllocationApiException extends RuntimeException {

    /** Status used when no HTTP response was received. */
    public static final int NO_RESPONSE = -1;

    private final int statusCode;
    private final Map<String, Object> details;

    public AllocationApiException(int statusCode, String message, Map<String, Object> details) {
        super(message);
        this.statusCode = statusCode;
        this.details = details != null ? Collections.unmodifiableMap(details) : Collections.emptyMap();
    }

    public AllocationApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_RESPONSE;
        this.details = Collections.emptyMap();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
