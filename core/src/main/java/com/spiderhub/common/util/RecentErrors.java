package com.spiderhub.common.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded ring buffer of the most recent error messages. Oldest entries drop out first.
 */
public class RecentErrors {
    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final Deque<String> buffer = new ArrayDeque<>();

    public RecentErrors() {
        this(DEFAULT_CAPACITY);
    }

    public RecentErrors(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void add(String message) {
        if (buffer.size() == capacity) buffer.removeFirst();
        buffer.addLast(message == null ? "unknown" : message);
    }

    public synchronized List<String> snapshot() {
        return new ArrayList<>(buffer);
    }

    public synchronized void clear() {
        buffer.clear();
    }
}
