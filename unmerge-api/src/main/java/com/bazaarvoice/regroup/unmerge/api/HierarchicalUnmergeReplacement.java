package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits one group into many by a level of the events' hierarchical hashes.  Only events with the given primary hash
 * whose hierarchical hash at {@code filterLevel} equals {@code filterHierarchicalHash} move.  Each moved event lands
 * in a group keyed by its hierarchical hash at {@code newLevel}, or by its most specific hash when the event's
 * sequence is shorter than that.
 * <p>
 * Once the split completes every hash in {@code resetHashes} which is still marked as split is unlocked.  If
 * {@code assumeSourceEmptied} is set the source group is excluded from the event stream at the end of the run instead
 * of checking whether any events remain in it.
 */
@JsonTypeName("hierarchical")
public final class HierarchicalUnmergeReplacement implements UnmergeReplacement {

    private final String _primaryHash;
    private final String _filterHierarchicalHash;
    private final int _filterLevel;
    private final int _newLevel;
    private final boolean _assumeSourceEmptied;
    private final List<String> _resetHashes;

    @JsonCreator
    public HierarchicalUnmergeReplacement(@JsonProperty("primaryHash") String primaryHash,
                                          @JsonProperty("filterHierarchicalHash") String filterHierarchicalHash,
                                          @JsonProperty("filterLevel") int filterLevel,
                                          @JsonProperty("newLevel") int newLevel,
                                          @JsonProperty("assumeSourceEmptied") boolean assumeSourceEmptied,
                                          @JsonProperty("resetHashes") @Nullable List<String> resetHashes) {
        _primaryHash = checkNotNull(primaryHash, "primaryHash");
        _filterHierarchicalHash = checkNotNull(filterHierarchicalHash, "filterHierarchicalHash");
        checkArgument(filterLevel >= 0, "filterLevel must be non-negative");
        checkArgument(newLevel >= 0, "newLevel must be non-negative");
        _filterLevel = filterLevel;
        _newLevel = newLevel;
        _assumeSourceEmptied = assumeSourceEmptied;
        _resetHashes = resetHashes != null ? ImmutableList.copyOf(resetHashes) : ImmutableList.of();
    }

    public String getPrimaryHash() {
        return _primaryHash;
    }

    public String getFilterHierarchicalHash() {
        return _filterHierarchicalHash;
    }

    public int getFilterLevel() {
        return _filterLevel;
    }

    public int getNewLevel() {
        return _newLevel;
    }

    public boolean isAssumeSourceEmptied() {
        return _assumeSourceEmptied;
    }

    public List<String> getResetHashes() {
        return _resetHashes;
    }

    @Override
    public <T> T visit(UnmergeReplacementVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HierarchicalUnmergeReplacement)) {
            return false;
        }
        HierarchicalUnmergeReplacement that = (HierarchicalUnmergeReplacement) o;
        return _filterLevel == that._filterLevel &&
                _newLevel == that._newLevel &&
                _assumeSourceEmptied == that._assumeSourceEmptied &&
                _primaryHash.equals(that._primaryHash) &&
                _filterHierarchicalHash.equals(that._filterHierarchicalHash) &&
                _resetHashes.equals(that._resetHashes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_primaryHash, _filterHierarchicalHash, _filterLevel, _newLevel, _assumeSourceEmptied, _resetHashes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("primaryHash", _primaryHash)
                .add("filterHierarchicalHash", _filterHierarchicalHash)
                .add("filterLevel", _filterLevel)
                .add("newLevel", _newLevel)
                .add("assumeSourceEmptied", _assumeSourceEmptied)
                .add("resetHashes", _resetHashes)
                .toString();
    }
}
