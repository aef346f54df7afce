package org.talentia.engine.domain.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for failures an allocation request reports to its caller.
 * The message is the localized, user-facing text; internal detail stays in
 * the cause and the logs.
 */
public abstract class AllocationException extends RuntimeException {

    private final Map<String, Object> details;

    protected AllocationException(String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    /**
     * HTTP status the API maps this failure to.
     */
    public abstract int getHttpStatus();

    public Map<String, Object> getDetails() {
        return details;
    }
}
