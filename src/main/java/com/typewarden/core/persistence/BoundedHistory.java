package com.typewarden.core.persistence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Append-only log with a fixed capacity; the oldest entry is evicted first.
 * Loaded from its store on construction and written back after every append.
 */
public class BoundedHistory<T> {

    private final Deque<T> entries = new ArrayDeque<>();
    private final int capacity;
    private final HistoryStore<T> store;

    public BoundedHistory(int capacity, HistoryStore<T> store) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.store = store;
        for (T entry : store.load()) {
            if (entry != null) {
                addEvicting(entry);
            }
        }
    }

    public synchronized void append(T entry) {
        addEvicting(entry);
        store.save(new ArrayList<>(entries));
    }

    /** Oldest first. */
    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized T latest() {
        return entries.peekLast();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    private void addEvicting(T entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }
}
