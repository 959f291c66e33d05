package com.continuum.relayer.oms;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Ordered, deduplicated list of order ids awaiting an execution attempt.
 *
 * <p>Holds orders whose ledger sequence is known: freshly resolved sequences and retries
 * coming back from backoff. Only the engine mutates it.
 */
@Component
public class ExecutionQueue {

    private final Deque<String> order = new ArrayDeque<>();
    private final Set<String> members = new HashSet<>();

    /** Appends the id unless it is already queued. */
    public synchronized boolean enqueue(String orderId) {
        if (!members.add(orderId)) {
            return false;
        }
        order.addLast(orderId);
        return true;
    }

    public synchronized Optional<String> dequeueNext() {
        String next = order.pollFirst();
        if (next != null) {
            members.remove(next);
        }
        return Optional.ofNullable(next);
    }

    /**
     * Puts a just-dequeued id back at the head, used when the engine could not act on it this
     * tick and must not lose its position.
     */
    public synchronized void restoreToHead(String orderId) {
        if (members.add(orderId)) {
            order.addFirst(orderId);
        }
    }

    public synchronized boolean remove(String orderId) {
        if (!members.remove(orderId)) {
            return false;
        }
        order.remove(orderId);
        return true;
    }

    public synchronized boolean contains(String orderId) {
        return members.contains(orderId);
    }

    public synchronized int size() {
        return order.size();
    }

    public synchronized List<String> snapshot() {
        return List.copyOf(order);
    }
}
