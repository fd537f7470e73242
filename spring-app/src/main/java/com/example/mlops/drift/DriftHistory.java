package com.example.mlops.drift;

import com.example.mlops.RetrainProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of drift reports, oldest first. Only retention pruning removes entries.
 */
@Component
public class DriftHistory {

    private final int retention;
    private final Deque<DriftReport> reports = new ArrayDeque<>();

    @Autowired
    public DriftHistory(RetrainProperties props) {
        this(props.getHistoryRetention());
    }

    public DriftHistory(int retention) {
        this.retention = Math.max(1, retention);
    }

    public synchronized void append(DriftReport report) {
        reports.addLast(report);
        while (reports.size() > retention) reports.removeFirst();
    }

    /** All retained reports in evaluation order. */
    public synchronized List<DriftReport> snapshot() {
        return List.copyOf(reports);
    }

    /** Up to {@code limit} most recent reports, newest last. */
    public synchronized List<DriftReport> recent(int limit) {
        List<DriftReport> all = new ArrayList<>(reports);
        return List.copyOf(all.subList(Math.max(0, all.size() - Math.max(0, limit)), all.size()));
    }

    public synchronized Optional<DriftReport> latest() {
        return Optional.ofNullable(reports.peekLast());
    }

    public synchronized int size() {
        return reports.size();
    }
}
