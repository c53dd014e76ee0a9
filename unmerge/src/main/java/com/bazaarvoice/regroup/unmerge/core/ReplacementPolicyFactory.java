package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.EventStream;
import com.bazaarvoice.regroup.unmerge.api.HashLockStore;
import com.bazaarvoice.regroup.unmerge.api.HierarchicalUnmergeReplacement;
import com.bazaarvoice.regroup.unmerge.api.PrimaryHashUnmergeReplacement;
import com.bazaarvoice.regroup.unmerge.api.UnmergeReplacement;
import com.bazaarvoice.regroup.unmerge.api.UnmergeReplacementVisitor;
import com.google.inject.Inject;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Binds a replacement to the stores its policy writes to.
 */
public class ReplacementPolicyFactory {

    private final HashLockStore _hashLockStore;
    private final EventStream _eventStream;

    @Inject
    public ReplacementPolicyFactory(HashLockStore hashLockStore, EventStream eventStream) {
        _hashLockStore = checkNotNull(hashLockStore, "hashLockStore");
        _eventStream = checkNotNull(eventStream, "eventStream");
    }

    public ReplacementPolicy forReplacement(UnmergeReplacement replacement) {
        checkNotNull(replacement, "replacement");
        return replacement.visit(new UnmergeReplacementVisitor<ReplacementPolicy>() {
            @Override
            public ReplacementPolicy visit(PrimaryHashUnmergeReplacement primaryHash) {
                return new PrimaryHashReplacementPolicy(primaryHash, _hashLockStore, _eventStream);
            }

            @Override
            public ReplacementPolicy visit(HierarchicalUnmergeReplacement hierarchical) {
                return new HierarchicalReplacementPolicy(hierarchical, _hashLockStore, _eventStream);
            }
        });
    }
}
