package com.bazaarvoice.regroup.queue.core;

import com.bazaarvoice.regroup.common.json.JsonHelper;
import com.bazaarvoice.regroup.queue.api.Message;
import com.bazaarvoice.regroup.queue.api.QueueService;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Queue service which keeps every queue in memory.  Payloads are copied through JSON on the way in so callers see
 * the same value types a remote queue would hand back.
 */
public class InMemoryQueueService implements QueueService {

    private static final Logger _log = LoggerFactory.getLogger(InMemoryQueueService.class);

    private final ConcurrentMap<String, Map<String, Message>> _queues = Maps.newConcurrentMap();
    private final AtomicLong _nextMessageId = new AtomicLong(1);

    @Override
    public void send(String queue, Object message) {
        sendAll(queue, Collections.singleton(message));
    }

    @Override
    public void sendAll(String queue, Collection<?> messages) {
        requireNonNull(queue, "queue");
        requireNonNull(messages, "messages");

        Map<String, Message> pending = getQueue(queue);
        synchronized (pending) {
            for (Object message : messages) {
                checkArgument(message != null, "Message cannot be null");
                String id = Long.toString(_nextMessageId.getAndIncrement());
                pending.put(id, new Message(id, JsonHelper.convert(message, Object.class)));
            }
        }
        _log.debug("Sent {} message(s) to queue {}", messages.size(), queue);
    }

    @Override
    public long getMessageCount(String queue) {
        Map<String, Message> pending = getQueue(queue);
        synchronized (pending) {
            return pending.size();
        }
    }

    @Override
    public List<Message> peek(String queue, int limit) {
        checkArgument(limit > 0, "Limit must be >0");
        Map<String, Message> pending = getQueue(queue);
        synchronized (pending) {
            return ImmutableList.copyOf(Iterables.limit(pending.values(), limit));
        }
    }

    @Override
    public void acknowledge(String queue, Collection<String> messageIds) {
        requireNonNull(messageIds, "messageIds");
        Map<String, Message> pending = getQueue(queue);
        synchronized (pending) {
            pending.keySet().removeAll(messageIds);
        }
    }

    @Override
    public void purge(String queue) {
        Map<String, Message> pending = getQueue(queue);
        synchronized (pending) {
            pending.clear();
        }
    }

    private Map<String, Message> getQueue(String queue) {
        requireNonNull(queue, "queue");
        return _queues.computeIfAbsent(queue, name -> new LinkedHashMap<>());
    }
}
