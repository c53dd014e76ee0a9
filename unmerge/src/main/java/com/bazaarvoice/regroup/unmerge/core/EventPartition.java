package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.Event;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A page's events split into those which stay in the source group and those which move, by unmerge key.  Every
 * event lands on exactly one side.  Keys and events keep the page's order.
 */
class EventPartition {

    private final List<Event> _stays;
    private final ListMultimap<String, Event> _moves;

    private EventPartition(List<Event> stays, ListMultimap<String, Event> moves) {
        _stays = stays;
        _moves = moves;
    }

    static EventPartition of(List<Event> events, ReplacementPolicy policy, Set<String> lockedPrimaryHashes) {
        ImmutableList.Builder<Event> stays = ImmutableList.builder();
        ImmutableListMultimap.Builder<String, Event> moves = ImmutableListMultimap.builder();

        for (Event event : events) {
            Optional<String> unmergeKey = policy.getUnmergeKey(event, lockedPrimaryHashes);
            if (unmergeKey.isPresent()) {
                moves.put(unmergeKey.get(), event);
            } else {
                stays.add(event);
            }
        }

        return new EventPartition(stays.build(), moves.build());
    }

    List<Event> getStays() {
        return _stays;
    }

    ListMultimap<String, Event> getMoves() {
        return _moves;
    }

    boolean hasMoves() {
        return !_moves.isEmpty();
    }
}
