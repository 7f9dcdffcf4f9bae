package com.substratebridge.relay.relay;

import com.substratebridge.core.msg.Message;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Restores delivery order over completions that arrive in any order.
 * <p>
 * Messages are tracked as they are delivered. Completing a message releases the longest prefix of
 * tracked messages that are all complete, so a release never skips an incomplete message.
 * </p>
 */
public class OrderedAckBuffer {

    private final Deque<Message> tracked = new ArrayDeque<>();
    private final Map<Message, Boolean> completed = new IdentityHashMap<>();

    public synchronized void track(Message message) {
        if (completed.containsKey(message)) {
            throw new IllegalStateException("Message already tracked: " + message);
        }
        tracked.addLast(message);
        completed.put(message, Boolean.FALSE);
    }

    /**
     * @param message a tracked message
     * @return messages now releasable, in delivery order; empty while an earlier message is incomplete
     * @throws IllegalStateException when the message is not tracked
     */
    public synchronized List<Message> complete(Message message) {
        if (!completed.containsKey(message)) {
            throw new IllegalStateException("Completion of untracked message: " + message);
        }
        completed.put(message, Boolean.TRUE);

        if (tracked.peekFirst() != message) {
            return Collections.emptyList();
        }
        List<Message> released = new ArrayList<>();
        while (!tracked.isEmpty() && completed.get(tracked.peekFirst())) {
            Message head = tracked.removeFirst();
            completed.remove(head);
            released.add(head);
        }
        return released;
    }

    public synchronized int pending() {
        return tracked.size();
    }
}
