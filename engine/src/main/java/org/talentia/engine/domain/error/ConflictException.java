package org.talentia.engine.domain.error;

import java.util.Map;

/**
 * The request is valid but cannot proceed in the current state: the position
 * is already assigned, there are no active recruiters, or no capacity is left.
 */
public class ConflictException extends AllocationException {

    public ConflictException(String message) {
        super(message, null, null);
    }

    public ConflictException(String message, Map<String, Object> details) {
        super(message, details, null);
    }

    @Override
    public int getHttpStatus() {
        return 409;
    }
}
