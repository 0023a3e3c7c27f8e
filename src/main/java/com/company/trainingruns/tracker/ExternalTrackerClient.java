package com.company.trainingruns.tracker;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to the external experiment tracker.
 * <p>
 * Implementations bound every call with a timeout and report transport or server
 * errors as {@link com.company.trainingruns.exception.ExternalServiceException}.
 */
public interface ExternalTrackerClient {

    /**
     * @return the record, or empty if the tracker has no run with this id
     */
    Optional<TrackerRun> getById(String entity, String project, String id);

    List<TrackerRun> searchByName(String entity, String project, String displayName);

    /**
     * @param order tracker sort expression, e.g. {@code -created_at}
     */
    List<TrackerRun> listAll(String entity, String project, String order);

    /**
     * Full metric history, one map of metric name to value per logged step.
     */
    List<Map<String, Object>> scanHistory(String entity, String project, String id);
}
