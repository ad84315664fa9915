package com.caffe.emergency.service;

import com.caffe.emergency.model.Alert;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory index of open alerts (active, acknowledged, escalated). Owned by
 * {@link EmergencyAlertEngine}; only its serialized transitions call {@link #put} and
 * {@link #remove}.
 */
public class AlertStore {

    private final AlertHistoryReplayer replayer;
    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    public AlertStore(AlertHistoryReplayer replayer) {
        this.replayer = replayer;
    }

    /**
     * Replaces the index with every alert whose replayed status is not resolved.
     *
     * @return the retained alerts
     */
    public List<Alert> rebuild() {
        List<Alert> open = replayer.replayAll().stream()
                .filter(alert -> alert.getStatus().isOpen())
                .collect(Collectors.toList());

        alerts.clear();
        open.forEach(alert -> alerts.put(alert.getId(), alert));
        return open;
    }

    public Optional<Alert> get(String id) {
        return Optional.ofNullable(alerts.get(id));
    }

    public List<Alert> list() {
        return alerts.values().stream()
                .sorted(Comparator.comparing(Alert::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());
    }

    public int size() {
        return alerts.size();
    }

    void put(Alert alert) {
        alerts.put(alert.getId(), alert);
    }

    void remove(String id) {
        alerts.remove(id);
    }
}
