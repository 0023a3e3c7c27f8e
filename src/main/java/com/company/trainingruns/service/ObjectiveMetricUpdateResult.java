package com.company.trainingruns.service;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of applying tracker metric values to a run's objectives.
 */
@Getter
public class ObjectiveMetricUpdateResult {

    private int objectivesUpdated;
    private final List<String> malformedKeys = new ArrayList<>();
    private final List<String> unmatchedKeys = new ArrayList<>();

    void recordUpdate() {
        objectivesUpdated++;
    }

    void recordMalformed(String key) {
        malformedKeys.add(key);
    }

    void recordUnmatched(String key) {
        unmatchedKeys.add(key);
    }

    public boolean hasMalformed() {
        return !malformedKeys.isEmpty();
    }

    public List<String> getMalformedKeys() {
        return Collections.unmodifiableList(malformedKeys);
    }

    public List<String> getUnmatchedKeys() {
        return Collections.unmodifiableList(unmatchedKeys);
    }
}
