package com.bazaarvoice.regroup.unmerge.api;

/**
 * Lock state of a hash lock table entry.
 */
public enum HashState {
    UNLOCKED,
    // Claimed by a running unmerge of primary hashes
    LOCKED_IN_MIGRATION,
    // The hash has been subdivided by a hierarchical split
    SPLIT,
}
