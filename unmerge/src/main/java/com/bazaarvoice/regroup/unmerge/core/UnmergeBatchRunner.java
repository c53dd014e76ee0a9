package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.ActivityLog;
import com.bazaarvoice.regroup.unmerge.api.Event;
import com.bazaarvoice.regroup.unmerge.api.EventPage;
import com.bazaarvoice.regroup.unmerge.api.EventSource;
import com.bazaarvoice.regroup.unmerge.api.GroupStore;
import com.bazaarvoice.regroup.unmerge.api.HashLockStore;
import com.bazaarvoice.regroup.unmerge.api.HashState;
import com.bazaarvoice.regroup.unmerge.api.InitialUnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.SuccessiveUnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.UnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.UnmergeArgsVisitor;
import com.bazaarvoice.regroup.unmerge.api.UnmergeDestination;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Processes a single page of an unmerge run.
 * <p>
 * A run starts with {@link InitialUnmergeArgs}.  Initial pages lock the replacement's hashes and read the source group
 * until they find an event to move.  The page that finds the first such event creates its destinations, starts their
 * streams and hands over to {@link SuccessiveUnmergeArgs} at the beginning of the group, so every event staying in the
 * source reaches the source group's fields.  Successive pages do the actual moving page by page.
 * <p>
 * Every page may be run more than once.  Nothing a page decides is visible to later pages except through the
 * arguments it returns, and every store write is one that can safely be repeated.  Initial pages never change hash
 * ownership, so a repeated initial page locks the same hashes.  Within a page, hash ownership is changed before event
 * rows are moved, and the event rows are the last write.
 */
public class UnmergeBatchRunner {

    private static final Logger _log = LoggerFactory.getLogger(UnmergeBatchRunner.class);

    private final EventSource _eventSource;
    private final HashLockStore _hashLockStore;
    private final GroupStore _groupStore;
    private final ActivityLog _activityLog;
    private final ReplacementPolicyFactory _policyFactory;

    @Inject
    public UnmergeBatchRunner(EventSource eventSource, HashLockStore hashLockStore, GroupStore groupStore,
                              ActivityLog activityLog, ReplacementPolicyFactory policyFactory) {
        _eventSource = checkNotNull(eventSource, "eventSource");
        _hashLockStore = checkNotNull(hashLockStore, "hashLockStore");
        _groupStore = checkNotNull(groupStore, "groupStore");
        _activityLog = checkNotNull(activityLog, "activityLog");
        _policyFactory = checkNotNull(policyFactory, "policyFactory");
    }

    public UnmergePage runPage(UnmergeArgs args) {
        checkNotNull(args, "args");
        final ReplacementPolicy policy = _policyFactory.forReplacement(args.getReplacement());

        return args.visit(new UnmergeArgsVisitor<UnmergePage>() {
            @Override
            public UnmergePage visit(InitialUnmergeArgs initial) {
                return runInitialPage(initial, policy);
            }

            @Override
            public UnmergePage visit(SuccessiveUnmergeArgs successive) {
                return runSuccessivePage(successive, policy);
            }
        });
    }

    private UnmergePage runInitialPage(InitialUnmergeArgs args, ReplacementPolicy policy) {
        Set<String> hashesToLock = policy.getPrimaryHashesToLock();
        Set<String> locked = ImmutableSet.of();
        if (!hashesToLock.isEmpty()) {
            locked = ImmutableSet.copyOf(_hashLockStore.lockHashes(args.getProjectId(), args.getSourceId(), hashesToLock));
            if (locked.isEmpty()) {
                _log.info("Unmerge {} of group {} found none of its {} hashes owned by the group",
                        args.getRunId(), args.getSourceId(), hashesToLock.size());
                return UnmergePage.finished(0, 0);
            }
        }

        EventPage page = fetchPage(args);
        EventPartition partition = EventPartition.of(page.getEvents(), policy, locked);

        if (!partition.hasMoves()) {
            if (page.isExhausted()) {
                unlock(args, locked);
                _log.info("Unmerge {} of group {} found no events to move", args.getRunId(), args.getSourceId());
                return UnmergePage.finished(0, 0);
            }
            _log.debug("Unmerge {} found no events to move before cursor {}", args.getRunId(), page.getNextCursor());
            return UnmergePage.next(args.withCursor(page.getNextCursor()), 0, 0);
        }

        // Only the destinations are written here.  Moving starts over from the beginning of the group.
        Map<String, UnmergeDestination> destinations = Maps.newLinkedHashMap(args.getDestinations());
        for (String unmergeKey : partition.getMoves().keySet()) {
            prepareDestination(args, policy, destinations, unmergeKey, partition.getMoves().get(unmergeKey));
        }
        _log.info("Unmerge {} of group {} found events to move {}; moving from the start of the group",
                args.getRunId(), args.getSourceId(), args.getCursor() == null ? "on its first page" : "after scanning");
        return UnmergePage.next(new SuccessiveUnmergeArgs(args.getRunId(), args.getProjectId(), args.getSourceId(),
                args.getReplacement(), args.getActorId(), args.getBatchSize(), destinations, null, locked, false), 0, 0);
    }

    private UnmergePage runSuccessivePage(SuccessiveUnmergeArgs args, ReplacementPolicy policy) {
        String projectId = args.getProjectId();
        String sourceId = args.getSourceId();
        Set<String> locked = args.getLockedPrimaryHashes();
        EventPage page = fetchPage(args);
        EventPartition partition = EventPartition.of(page.getEvents(), policy, locked);
        Map<String, UnmergeDestination> destinations = Maps.newLinkedHashMap(args.getDestinations());

        // Destination groups
        for (String unmergeKey : partition.getMoves().keySet()) {
            List<Event> events = partition.getMoves().get(unmergeKey);
            if (prepareDestination(args, policy, destinations, unmergeKey, events)) {
                _groupStore.backfillGroup(projectId, destinations.get(unmergeKey).getGroupId(), events);
            }
        }

        // Source group fields
        List<Event> stays = partition.getStays();
        boolean reset = args.isSourceFieldsReset();
        if (!stays.isEmpty()) {
            if (!reset) {
                _groupStore.resetSourceFields(projectId, sourceId, stays);
                reset = true;
                _log.debug("Unmerge {} reset the fields of group {}", args.getRunId(), sourceId);
            } else {
                _groupStore.backfillGroup(projectId, sourceId, stays);
            }
        }

        // Hash ownership, then the event rows themselves
        Map<String, String> destinationIdByEventId = Maps.newLinkedHashMap();
        for (String unmergeKey : partition.getMoves().keySet()) {
            String destinationId = destinations.get(unmergeKey).getGroupId();
            policy.reassignHashes(projectId, unmergeKey, destinationId, locked);
            for (Event event : partition.getMoves().get(unmergeKey)) {
                destinationIdByEventId.put(event.getEventId(), destinationId);
            }
        }
        if (!destinationIdByEventId.isEmpty()) {
            _groupStore.moveEvents(projectId, destinationIdByEventId);
        }

        int moved = destinationIdByEventId.size();
        _log.debug("Unmerge {} moved {} and kept {} events of group {}", args.getRunId(), moved, stays.size(), sourceId);

        if (page.isExhausted()) {
            finish(args, policy, destinations, locked);
            return UnmergePage.finished(moved, stays.size());
        }

        return UnmergePage.next(new SuccessiveUnmergeArgs(args.getRunId(), projectId, sourceId, args.getReplacement(),
                args.getActorId(), args.getBatchSize(), destinations, page.getNextCursor(), locked, reset),
                moved, stays.size());
    }

    private void finish(UnmergeArgs args, ReplacementPolicy policy, Map<String, UnmergeDestination> destinations,
                        Set<String> locked) {
        String projectId = args.getProjectId();
        String sourceId = args.getSourceId();

        for (Map.Entry<String, UnmergeDestination> entry : destinations.entrySet()) {
            _activityLog.record(projectId, sourceId, entry.getValue().getGroupId(), args.getActorId(),
                    policy.getActivityData(entry.getKey()));
        }
        for (UnmergeDestination destination : destinations.values()) {
            policy.stopStream(destination.getStreamState());
        }
        policy.onFinish(projectId, sourceId);
        unlock(args, locked);

        _log.info("Unmerge {} of group {} finished with {} destination(s)", args.getRunId(), sourceId, destinations.size());
    }

    /**
     * Makes sure the key has a destination group with a started stream.  Returns whether the group already existed,
     * in which case the events still have to be added to its fields.
     */
    private boolean prepareDestination(UnmergeArgs args, ReplacementPolicy policy,
                                       Map<String, UnmergeDestination> destinations, String unmergeKey,
                                       List<Event> events) {
        String projectId = args.getProjectId();
        String sourceId = args.getSourceId();
        UnmergeDestination destination = destinations.get(unmergeKey);
        if (destination == null) {
            String destinationId = _groupStore.createGroup(projectId, args.getRunId(), unmergeKey, events);
            bindDestination(destinations, unmergeKey, new UnmergeDestination(destinationId,
                    policy.startStream(projectId, sourceId, unmergeKey, destinationId)));
            _log.info("Unmerge {} moves events for key {} into group {}", args.getRunId(), unmergeKey, destinationId);
            return false;
        }
        if (destination.getStreamState() == null) {
            // A destination supplied with the request has no stream yet
            bindDestination(destinations, unmergeKey, new UnmergeDestination(destination.getGroupId(),
                    policy.startStream(projectId, sourceId, unmergeKey, destination.getGroupId())));
        }
        return true;
    }

    /**
     * Keys are bound to one group for the life of a run, and no two keys share a group.
     */
    private void bindDestination(Map<String, UnmergeDestination> destinations, String unmergeKey,
                                 UnmergeDestination destination) {
        UnmergeDestination existing = destinations.get(unmergeKey);
        if (existing != null && !existing.getGroupId().equals(destination.getGroupId())) {
            throw new IllegalStateException(String.format("Unmerge key %s is bound to group %s, not %s",
                    unmergeKey, existing.getGroupId(), destination.getGroupId()));
        }
        for (Map.Entry<String, UnmergeDestination> entry : destinations.entrySet()) {
            if (!entry.getKey().equals(unmergeKey) && entry.getValue().getGroupId().equals(destination.getGroupId())) {
                throw new IllegalStateException(String.format("Group %s is already the destination of unmerge key %s",
                        destination.getGroupId(), entry.getKey()));
            }
        }
        destinations.put(unmergeKey, destination);
    }

    private EventPage fetchPage(UnmergeArgs args) {
        return _eventSource.fetchPage(args.getProjectId(), args.getSourceId(), args.getCursor(), args.getBatchSize());
    }

    private void unlock(UnmergeArgs args, Set<String> locked) {
        if (!locked.isEmpty()) {
            _hashLockStore.unlock(args.getProjectId(), locked, HashState.LOCKED_IN_MIGRATION);
        }
    }
}
