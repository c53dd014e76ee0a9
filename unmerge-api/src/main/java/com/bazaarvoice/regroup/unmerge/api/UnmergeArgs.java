package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Arguments for a single page of an unmerge run.  A run is a chain of pages, each of which is processed by one job
 * and hands its successor the state the next page needs.  There are two phases:
 * <ul>
 * <li>{@link InitialUnmergeArgs}: no events have been moved yet.</li>
 * <li>{@link SuccessiveUnmergeArgs}: a migrating event has been found, so the run carries its locked hashes,
 *     destinations and whether the source group's fields were already reset.</li>
 * </ul>
 * Instances are immutable; the only way to advance a run is to produce new arguments for the next page.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class UnmergeArgs {

    public static final int DEFAULT_BATCH_SIZE = 500;

    private final String _runId;
    private final String _projectId;
    private final String _sourceId;
    private final UnmergeReplacement _replacement;
    private final String _actorId;
    private final int _batchSize;
    private final Map<String, UnmergeDestination> _destinations;
    private final String _cursor;

    UnmergeArgs(String runId, String projectId, String sourceId, UnmergeReplacement replacement,
                @Nullable String actorId, int batchSize, Map<String, UnmergeDestination> destinations,
                @Nullable String cursor) {
        _runId = checkNotNull(runId, "runId");
        _projectId = checkNotNull(projectId, "projectId");
        _sourceId = checkNotNull(sourceId, "sourceId");
        _replacement = checkNotNull(replacement, "replacement");
        _actorId = actorId;
        checkArgument(batchSize > 0, "batchSize must be positive");
        _batchSize = batchSize;
        _destinations = ImmutableMap.copyOf(checkNotNull(destinations, "destinations"));
        _cursor = cursor;
    }

    /**
     * Parses serialized page arguments.  Besides the canonical fields this accepts the legacy single-destination
     * form, where {@code destinationId} and {@code eventStreamState} describe the only destination and
     * {@code fingerprints} stands in for a primary hash replacement.  A legacy successive page is recognized by
     * {@code lastEvent}.
     */
    @JsonCreator
    public static UnmergeArgs parse(@JsonProperty("runId") @Nullable String runId,
                                    @JsonProperty("projectId") @Nullable String projectId,
                                    @JsonProperty("sourceId") @Nullable String sourceId,
                                    @JsonProperty("destinationId") @Nullable String destinationId,
                                    @JsonProperty("fingerprints") @Nullable Collection<String> fingerprints,
                                    @JsonProperty("actorId") @Nullable String actorId,
                                    @JsonProperty("lastEvent") @Nullable String lastEvent,
                                    @JsonProperty("cursor") @Nullable String cursor,
                                    @JsonProperty("batchSize") @Nullable Integer batchSize,
                                    @JsonProperty("sourceFieldsReset") @Nullable Boolean sourceFieldsReset,
                                    @JsonProperty("eventStreamState") @Nullable Map<String, Object> eventStreamState,
                                    @JsonProperty("replacement") @Nullable UnmergeReplacement replacement,
                                    @JsonProperty("lockedPrimaryHashes") @Nullable Collection<String> lockedPrimaryHashes,
                                    @JsonProperty("destinations") @Nullable Map<String, UnmergeDestination> destinations) {
        if (projectId == null || sourceId == null) {
            throw new InvalidUnmergeArgsException("Unmerge arguments require a projectId and a sourceId");
        }
        if (runId == null) {
            // Pages written before runs had ids.  All pages of such a run share the same source, so key on that.
            runId = "legacy:" + projectId + ":" + sourceId;
        }
        int pageSize = batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
        if (pageSize <= 0) {
            throw new InvalidUnmergeArgsException("batchSize must be positive: " + pageSize);
        }

        if (destinations == null) {
            if (destinationId != null) {
                destinations = ImmutableMap.of(PrimaryHashUnmergeReplacement.DEFAULT_UNMERGE_KEY,
                        new UnmergeDestination(destinationId, eventStreamState));
            } else {
                destinations = ImmutableMap.of();
            }
        }

        UnmergeReplacement parsedReplacement = parseReplacement(fingerprints, replacement);
        boolean reset = sourceFieldsReset != null && sourceFieldsReset;

        if (lockedPrimaryHashes == null && lastEvent == null) {
            if (eventStreamState != null || hasStreamState(destinations)) {
                throw new InvalidUnmergeArgsException("An initial unmerge page cannot carry event stream state");
            }
            if (reset) {
                throw new InvalidUnmergeArgsException("An initial unmerge page cannot have reset the source fields");
            }
            return new InitialUnmergeArgs(runId, projectId, sourceId, parsedReplacement, actorId, pageSize,
                    destinations, cursor);
        }

        Collection<String> locked = lockedPrimaryHashes != null ? lockedPrimaryHashes : fingerprints;
        if (locked == null) {
            throw new InvalidUnmergeArgsException("A successive unmerge page requires its locked primary hashes");
        }
        if (destinations.isEmpty()) {
            throw new InvalidUnmergeArgsException("A successive unmerge page requires its destinations");
        }
        return new SuccessiveUnmergeArgs(runId, projectId, sourceId, parsedReplacement, actorId, pageSize,
                destinations, cursor != null ? cursor : lastEvent, locked, reset);
    }

    private static UnmergeReplacement parseReplacement(@Nullable Collection<String> fingerprints,
                                                       @Nullable UnmergeReplacement replacement) {
        if (replacement != null) {
            return replacement;
        }
        if (fingerprints != null && !fingerprints.isEmpty()) {
            return new PrimaryHashUnmergeReplacement(fingerprints);
        }
        throw new InvalidUnmergeArgsException("Either fingerprints or a replacement is required");
    }

    private static boolean hasStreamState(Map<String, UnmergeDestination> destinations) {
        for (UnmergeDestination destination : destinations.values()) {
            if (destination.getStreamState() != null) {
                return true;
            }
        }
        return false;
    }

    public abstract <T> T visit(UnmergeArgsVisitor<T> visitor);

    /** Identifies the run this page belongs to.  Every page of a run has the same run id. */
    public String getRunId() {
        return _runId;
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

    public int getBatchSize() {
        return _batchSize;
    }

    /** Destinations by unmerge key, in the order they were first seen. */
    public Map<String, UnmergeDestination> getDestinations() {
        return _destinations;
    }

    /** Position in the source group to read the page from, or null to read from the start of the group. */
    @Nullable
    public String getCursor() {
        return _cursor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        UnmergeArgs that = (UnmergeArgs) o;
        return _batchSize == that._batchSize &&
                _runId.equals(that._runId) &&
                _projectId.equals(that._projectId) &&
                _sourceId.equals(that._sourceId) &&
                _replacement.equals(that._replacement) &&
                Objects.equals(_actorId, that._actorId) &&
                _destinations.equals(that._destinations) &&
                Objects.equals(_cursor, that._cursor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_runId, _sourceId, _cursor);
    }
}
