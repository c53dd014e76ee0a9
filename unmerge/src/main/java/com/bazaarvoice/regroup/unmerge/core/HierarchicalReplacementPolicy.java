package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.Event;
import com.bazaarvoice.regroup.unmerge.api.EventStream;
import com.bazaarvoice.regroup.unmerge.api.HashLockStore;
import com.bazaarvoice.regroup.unmerge.api.HashState;
import com.bazaarvoice.regroup.unmerge.api.HierarchicalUnmergeReplacement;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Splits the events of one primary hash by a level of their hierarchical hashes, creating one destination per
 * distinct hash at the new level.
 */
public class HierarchicalReplacementPolicy implements ReplacementPolicy {

    private final HierarchicalUnmergeReplacement _replacement;
    private final HashLockStore _hashLockStore;
    private final EventStream _eventStream;

    public HierarchicalReplacementPolicy(HierarchicalUnmergeReplacement replacement, HashLockStore hashLockStore,
                                         EventStream eventStream) {
        _replacement = requireNonNull(replacement, "replacement");
        _hashLockStore = requireNonNull(hashLockStore, "hashLockStore");
        _eventStream = requireNonNull(eventStream, "eventStream");
    }

    @Override
    public Optional<String> getUnmergeKey(Event event, Set<String> lockedPrimaryHashes) {
        if (!_replacement.getPrimaryHash().equals(event.getPrimaryHash())) {
            return Optional.empty();
        }

        List<String> hierarchicalHashes = event.getHierarchicalHashes();
        int filterLevel = _replacement.getFilterLevel();
        if (filterLevel >= hierarchicalHashes.size() ||
                !_replacement.getFilterHierarchicalHash().equals(hierarchicalHashes.get(filterLevel))) {
            return Optional.empty();
        }

        // Events without a hash at the new level go to the most specific level they have
        int newLevel = Math.min(_replacement.getNewLevel(), hierarchicalHashes.size() - 1);
        return Optional.of(hierarchicalHashes.get(newLevel));
    }

    @Override
    public Set<String> getPrimaryHashesToLock() {
        return ImmutableSet.of();
    }

    @Override
    public Map<String, Object> startStream(String projectId, String sourceId, String unmergeKey, String destinationId) {
        return _eventStream.startUnmergeHierarchical(projectId, _replacement.getPrimaryHash(), unmergeKey, sourceId,
                destinationId, _replacement.isAssumeSourceEmptied());
    }

    @Override
    public void stopStream(@Nullable Map<String, Object> streamState) {
        if (streamState != null) {
            _eventStream.endUnmergeHierarchical(streamState);
        }
    }

    @Override
    public void reassignHashes(String projectId, String unmergeKey, String destinationId, Set<String> lockedPrimaryHashes) {
        if (!_replacement.getResetHashes().isEmpty()) {
            _hashLockStore.unlock(projectId, _replacement.getResetHashes(), HashState.SPLIT);
        }
        _hashLockStore.upsert(projectId, unmergeKey, destinationId);
    }

    @Override
    public Map<String, Object> getActivityData(String unmergeKey) {
        return ImmutableMap.<String, Object>of("newHierarchicalHash", unmergeKey);
    }

    @Override
    public void onFinish(String projectId, String sourceId) {
        if (_replacement.isAssumeSourceEmptied()) {
            _eventStream.excludeGroups(projectId, ImmutableList.of(sourceId));
        }
    }
}
