package com.bazaarvoice.regroup.queue.api;

import java.util.Collection;
import java.util.List;

/**
 * Durable FIFO queue of opaque messages.  Messages remain visible to {@link #peek} until they are acknowledged,
 * so a consumer that dies before acknowledging will see the message again.
 */
public interface QueueService {

    void send(String queue, Object message);

    void sendAll(String queue, Collection<?> messages);

    /** Counts messages which have been sent but not yet acknowledged. */
    long getMessageCount(String queue);

    List<Message> peek(String queue, int limit);

    void acknowledge(String queue, Collection<String> messageIds);

    /** Delete all messages in the queue, for debugging/testing. */
    void purge(String queue);
}
