package org.talentia.engine.domain.error;

/**
 * No such position or recruiter, or nothing eligible to allocate.
 */
public class NotFoundException extends AllocationException {

    public NotFoundException(String message) {
        super(message, null, null);
    }

    @Override
    public int getHttpStatus() {
        return 404;
    }
}
