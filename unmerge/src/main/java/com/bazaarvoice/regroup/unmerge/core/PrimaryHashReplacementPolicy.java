package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.Event;
import com.bazaarvoice.regroup.unmerge.api.EventStream;
import com.bazaarvoice.regroup.unmerge.api.HashLockStore;
import com.bazaarvoice.regroup.unmerge.api.PrimaryHashUnmergeReplacement;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.bazaarvoice.regroup.unmerge.api.PrimaryHashUnmergeReplacement.DEFAULT_UNMERGE_KEY;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Moves every event whose primary hash is both one of the fingerprints and locked by this run into a single
 * destination.
 */
public class PrimaryHashReplacementPolicy implements ReplacementPolicy {

    private final PrimaryHashUnmergeReplacement _replacement;
    private final HashLockStore _hashLockStore;
    private final EventStream _eventStream;

    public PrimaryHashReplacementPolicy(PrimaryHashUnmergeReplacement replacement, HashLockStore hashLockStore,
                                        EventStream eventStream) {
        _replacement = requireNonNull(replacement, "replacement");
        _hashLockStore = requireNonNull(hashLockStore, "hashLockStore");
        _eventStream = requireNonNull(eventStream, "eventStream");
    }

    @Override
    public Optional<String> getUnmergeKey(Event event, Set<String> lockedPrimaryHashes) {
        String primaryHash = event.getPrimaryHash();
        if (_replacement.getFingerprints().contains(primaryHash) && lockedPrimaryHashes.contains(primaryHash)) {
            return Optional.of(DEFAULT_UNMERGE_KEY);
        }
        return Optional.empty();
    }

    @Override
    public Set<String> getPrimaryHashesToLock() {
        return _replacement.getFingerprints();
    }

    @Override
    public Map<String, Object> startStream(String projectId, String sourceId, String unmergeKey, String destinationId) {
        return _eventStream.startUnmerge(projectId, _replacement.getFingerprints(), sourceId, destinationId);
    }

    @Override
    public void stopStream(@Nullable Map<String, Object> streamState) {
        if (streamState != null) {
            _eventStream.endUnmerge(streamState);
        }
    }

    @Override
    public void reassignHashes(String projectId, String unmergeKey, String destinationId, Set<String> lockedPrimaryHashes) {
        _hashLockStore.reassign(projectId, lockedPrimaryHashes, destinationId);
    }

    @Override
    public Map<String, Object> getActivityData(String unmergeKey) {
        checkArgument(DEFAULT_UNMERGE_KEY.equals(unmergeKey), "Unexpected unmerge key: %s", unmergeKey);
        return ImmutableMap.<String, Object>of("fingerprints", ImmutableList.copyOf(_replacement.getFingerprints()));
    }

    @Override
    public void onFinish(String projectId, String sourceId) {
        // Nothing to do
    }
}
