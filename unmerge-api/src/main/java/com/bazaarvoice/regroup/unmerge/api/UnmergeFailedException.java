package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Thrown when an unmerge page could not be completed within the allowed number of attempts.  The run stops at that
 * page; events moved by earlier pages remain in their new groups.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class UnmergeFailedException extends RuntimeException {
    private final String _runId;
    private final int _attempts;

    public UnmergeFailedException(String runId, int attempts, Throwable cause) {
        super(String.format("Unmerge run %s failed after %d attempt(s): %s", runId, attempts, cause.getMessage()), cause);
        _runId = runId;
        _attempts = attempts;
    }

    public String getRunId() {
        return _runId;
    }

    public int getAttempts() {
        return _attempts;
    }
}
