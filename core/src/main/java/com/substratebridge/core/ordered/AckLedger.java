package com.substratebridge.core.ordered;

import com.substratebridge.core.error.InvalidAcknowledgmentException;
import com.substratebridge.core.msg.Message;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * FIFO record of delivered but not yet acknowledged messages.
 * <p>
 * <b>Invariant:</b> entries are kept in delivery order and only the head can be acknowledged.
 * Acknowledgments are matched by reference identity, never by content.
 * </p>
 * <p>
 * Appends happen on the delivery thread and acknowledgments on the caller's thread, so every
 * operation holds the ledger's monitor. Commit and pop of the head happen under the same lock.
 * </p>
 *
 * @param <T> delivered message type
 */
public class AckLedger<T extends Message> {

    private final Deque<T> pending = new ArrayDeque<>();

    public synchronized void append(T delivered) {
        pending.addLast(delivered);
    }

    /**
     * Accepts {@code ack} if it is the oldest outstanding delivery.
     *
     * @param ack      acknowledged message
     * @param onAccept invoked with the head before it is removed; if it throws, the head stays
     * @return the acknowledged delivery
     * @throws InvalidAcknowledgmentException if nothing is outstanding or {@code ack} is not the head
     */
    public synchronized T acknowledge(Message ack, Consumer<? super T> onAccept) {
        T head = pending.peekFirst();
        if (head == null) {
            throw new InvalidAcknowledgmentException(ack, null);
        }
        if (head != ack) {
            throw new InvalidAcknowledgmentException(ack, head);
        }
        onAccept.accept(head);
        pending.removeFirst();
        return head;
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    /**
     * Drops every outstanding delivery.
     *
     * @return number of dropped entries
     */
    public synchronized int clear() {
        int dropped = pending.size();
        pending.clear();
        return dropped;
    }
}
