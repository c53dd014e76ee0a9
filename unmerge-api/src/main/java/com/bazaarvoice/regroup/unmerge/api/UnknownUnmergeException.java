package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raised when the status of an unmerge is requested for a reference that does not exist.
 */
@JsonIgnoreProperties({"cause", "localizedMessage", "stackTrace"})
public class UnknownUnmergeException extends RuntimeException {
    private final String _reference;

    @JsonCreator
    public UnknownUnmergeException(@JsonProperty("reference") String reference) {
        super("Unknown unmerge: " + reference);
        _reference = reference;
    }

    public String getReference() {
        return _reference;
    }
}
