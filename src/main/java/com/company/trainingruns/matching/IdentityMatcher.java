package com.company.trainingruns.matching;

import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.tracker.TrackerRun;

import java.util.List;
import java.util.Optional;

/**
 * Links a local run that has no external id to one of the tracker's records.
 */
public interface IdentityMatcher {

    /**
     * @return the best candidate, or empty when none qualifies
     */
    Optional<TrackerRun> match(TrainingRun run, List<TrackerRun> candidates);
}
