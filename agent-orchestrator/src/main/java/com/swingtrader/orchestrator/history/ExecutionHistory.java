package com.swingtrader.orchestrator.history;

import com.swingtrader.orchestrator.result.ExecutionResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Most recent runs, in memory. Holds at most {@code capacity} results; the oldest is
 * dropped first.
 */
public class ExecutionHistory {

    private final int capacity;
    private final Deque<ExecutionResult> results = new ArrayDeque<>();

    public ExecutionHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("history capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void add(ExecutionResult result) {
        results.addLast(result);
        while (results.size() > capacity) {
            results.removeFirst();
        }
    }

    /** Up to {@code limit} results, newest first. */
    public synchronized List<ExecutionResult> list(int limit) {
        List<ExecutionResult> out = new ArrayList<>();
        Iterator<ExecutionResult> newestFirst = results.descendingIterator();
        while (newestFirst.hasNext() && out.size() < limit) {
            out.add(newestFirst.next());
        }
        return out;
    }

    public synchronized Optional<ExecutionResult> get(String executionId) {
        return results.stream().filter(r -> r.executionId().equals(executionId)).findFirst();
    }

    public synchronized int size() {
        return results.size();
    }

    public int capacity() {
        return capacity;
    }
}
