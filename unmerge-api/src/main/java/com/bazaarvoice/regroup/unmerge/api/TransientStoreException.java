package com.bazaarvoice.regroup.unmerge.api;

/**
 * Thrown by a store when a call fails for a reason which may clear up on its own, such as a timeout or the store
 * being temporarily unavailable.  The unmerge page which made the call is retried from the beginning.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message) {
        super(message);
    }

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
