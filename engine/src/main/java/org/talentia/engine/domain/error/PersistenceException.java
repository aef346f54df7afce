package org.talentia.engine.domain.error;

/**
 * A datastore write failed. Raised after any reserved capacity was released.
 */
public class PersistenceException extends AllocationException {

    public PersistenceException(String message, Throwable cause) {
        super(message, null, cause);
    }

    @Override
    public int getHttpStatus() {
        return 500;
    }
}
