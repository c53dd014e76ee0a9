package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Request to move the events selected by a replacement out of a source group.
 */
public final class UnmergeRequest {
    private final String _projectId;
    private final String _sourceId;
    private final UnmergeReplacement _replacement;
    private final String _actorId;
    private Integer _batchSize;
    private String _destinationId;

    @JsonCreator
    public UnmergeRequest(@JsonProperty("projectId") String projectId,
                          @JsonProperty("sourceId") String sourceId,
                          @JsonProperty("replacement") UnmergeReplacement replacement,
                          @JsonProperty("actorId") @Nullable String actorId) {
        _projectId = checkNotNull(projectId, "projectId");
        _sourceId = checkNotNull(sourceId, "sourceId");
        _replacement = checkNotNull(replacement, "replacement");
        _actorId = actorId;
    }

    public String getProjectId() {
        return _projectId;
    }

    public String getSourceId() {
        return _sourceId;
    }

    public UnmergeReplacement getReplacement() {
        return _replacement;
    }

    @Nullable
    public String getActorId() {
        return _actorId;
    }

    /** Page size override.  When null the service's configured batch size is used. */
    @Nullable
    public Integer getBatchSize() {
        return _batchSize;
    }

    @JsonProperty("batchSize")
    public UnmergeRequest batchSize(@Nullable Integer batchSize) {
        _batchSize = batchSize;
        return this;
    }

    /**
     * Existing group to move the events into instead of creating a new one.  Only meaningful for replacements with a
     * single unmerge key.
     */
    @Nullable
    public String getDestinationId() {
        return _destinationId;
    }

    @JsonProperty("destinationId")
    public UnmergeRequest destinationId(@Nullable String destinationId) {
        _destinationId = destinationId;
        return this;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("projectId", _projectId)
                .add("sourceId", _sourceId)
                .add("replacement", _replacement)
                .add("actorId", _actorId)
                .add("batchSize", _batchSize)
                .add("destinationId", _destinationId)
                .omitNullValues()
                .toString();
    }
}
