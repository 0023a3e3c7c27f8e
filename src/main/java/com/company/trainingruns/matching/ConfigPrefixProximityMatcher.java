package com.company.trainingruns.matching;

import com.company.trainingruns.config.TrainingRunProperties;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.tracker.TrackerRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches on the config prefix of the run id and the launch time.
 * <p>
 * Run ids have the form {@code {config_prefix}_{instance_suffix}}. A tracker record
 * qualifies when its name contains the config prefix and it was created within the
 * proximity window of the local run; the closest in time wins. Hyphens and
 * underscores are treated alike and case is ignored, since tracker names are derived
 * from host names.
 * <p>
 * Substring containment can pick the wrong record when one config prefix is part of
 * another's name. Runs with a known external id never reach this matcher.
 */
@Component
@Slf4j
public class ConfigPrefixProximityMatcher implements IdentityMatcher {

    private final Duration window;

    @Autowired
    public ConfigPrefixProximityMatcher(TrainingRunProperties properties) {
        this(properties.getMatching().getWindow());
    }

    public ConfigPrefixProximityMatcher(Duration window) {
        this.window = window;
    }

    @Override
    public Optional<TrackerRun> match(TrainingRun run, List<TrackerRun> candidates) {
        if (run.getRunId() == null || run.getCreatedAt() == null || candidates == null) {
            return Optional.empty();
        }

        String prefix = normalize(configPrefix(run.getRunId()));
        if (prefix.isEmpty()) {
            return Optional.empty();
        }

        Optional<TrackerRun> best = candidates.stream()
                .filter(c -> c.getName() != null && c.getCreatedAt() != null)
                .filter(c -> normalize(c.getName()).contains(prefix))
                .filter(c -> distance(run, c).compareTo(window) < 0)
                .min(Comparator.comparing(c -> distance(run, c)));

        best.ifPresent(c -> log.debug("Matched run {} to tracker run {} ({}s apart)",
                run.getRunId(), c.getId(), distance(run, c).getSeconds()));
        return best;
    }

    /**
     * Drops the trailing {@code _}-delimited instance segment.
     */
    static String configPrefix(String runId) {
        int idx = runId.lastIndexOf('_');
        return idx > 0 ? runId.substring(0, idx) : runId;
    }

    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static Duration distance(TrainingRun run, TrackerRun candidate) {
        return Duration.between(run.getCreatedAt(), candidate.getCreatedAt()).abs();
    }
}
