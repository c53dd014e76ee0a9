package com.bazaarvoice.regroup.unmerge.api;

/**
 * Thrown when an unmerge page descriptor is malformed, for example a successive page without its destinations.
 * The page cannot succeed no matter how often it is retried.
 */
public class InvalidUnmergeArgsException extends IllegalArgumentException {

    public InvalidUnmergeArgsException(String message) {
        super(message);
    }
}
