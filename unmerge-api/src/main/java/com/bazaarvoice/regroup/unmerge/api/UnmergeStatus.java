package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Progress of an unmerge run, following the run from the page a reference names to its most recent page.
 */
public final class UnmergeStatus {

    public enum Status {
        IN_PROGRESS,
        COMPLETE,
        ERROR
    }

    private final String _reference;
    private final String _currentReference;
    private final Status _status;
    private final int _pagesCompleted;
    private final long _eventsMoved;
    private final String _errorMessage;

    @JsonCreator
    public UnmergeStatus(@JsonProperty("reference") String reference,
                         @JsonProperty("currentReference") String currentReference,
                         @JsonProperty("status") Status status,
                         @JsonProperty("pagesCompleted") int pagesCompleted,
                         @JsonProperty("eventsMoved") long eventsMoved,
                         @JsonProperty("errorMessage") @Nullable String errorMessage) {
        _reference = checkNotNull(reference, "reference");
        _currentReference = checkNotNull(currentReference, "currentReference");
        _status = checkNotNull(status, "status");
        _pagesCompleted = pagesCompleted;
        _eventsMoved = eventsMoved;
        _errorMessage = errorMessage;
    }

    public String getReference() {
        return _reference;
    }

    /** Reference of the most recent page of the run. */
    public String getCurrentReference() {
        return _currentReference;
    }

    public Status getStatus() {
        return _status;
    }

    public int getPagesCompleted() {
        return _pagesCompleted;
    }

    public long getEventsMoved() {
        return _eventsMoved;
    }

    @Nullable
    public String getErrorMessage() {
        return _errorMessage;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("reference", _reference)
                .add("currentReference", _currentReference)
                .add("status", _status)
                .add("pagesCompleted", _pagesCompleted)
                .add("eventsMoved", _eventsMoved)
                .add("errorMessage", _errorMessage)
                .omitNullValues()
                .toString();
    }
}
