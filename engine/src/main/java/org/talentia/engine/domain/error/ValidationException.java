package org.talentia.engine.domain.error;

import java.util.Map;

/**
 * Malformed or missing request fields.
 */
public class ValidationException extends AllocationException {

    public ValidationException(String message) {
        super(message, null, null);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(message, details, null);
    }

    @Override
    public int getHttpStatus() {
        return 400;
    }
}
