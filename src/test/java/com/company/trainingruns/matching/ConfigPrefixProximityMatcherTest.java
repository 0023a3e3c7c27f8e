package com.company.trainingruns.matching;

import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.tracker.TrackerRun;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigPrefixProximityMatcherTest {

    private static final Instant T = Instant.parse("2024-05-01T12:00:00Z");

    private final ConfigPrefixProximityMatcher matcher = new ConfigPrefixProximityMatcher(Duration.ofMinutes(30));

    @Test
    void match_shouldPickPrefixMatchWithinWindow() {
        TrainingRun run = localRun("expA_v2_i-0abc123", T);
        TrackerRun expected = trackerRun("t1", "expA-v2-ip-10-0-0-1", T.plus(Duration.ofMinutes(5)));
        TrackerRun other = trackerRun("t2", "expB_i-xyz", T.plus(Duration.ofMinutes(1)));

        Optional<TrackerRun> match = matcher.match(run, List.of(expected, other));

        assertThat(match).containsSame(expected);
    }

    @Test
    void match_whenAllCandidatesOutsideWindow_shouldReturnEmpty() {
        TrainingRun run = localRun("expA_v2_i-0abc123", T);

        Optional<TrackerRun> match = matcher.match(run, List.of(
                trackerRun("t1", "expA-v2-ip-10-0-0-1", T.plus(Duration.ofMinutes(31))),
                trackerRun("t2", "expA_v2_ip-10-0-0-2", T.minus(Duration.ofHours(2)))));

        assertThat(match).isEmpty();
    }

    @Test
    void match_atExactWindowBoundary_shouldReturnEmpty() {
        TrainingRun run = localRun("expA_v2_i-0abc123", T);

        Optional<TrackerRun> match = matcher.match(run, List.of(
                trackerRun("t1", "expA-v2-ip-10-0-0-1", T.plus(Duration.ofMinutes(30)))));

        assertThat(match).isEmpty();
    }

    @Test
    void match_withSeveralQualifying_shouldPickClosestInTime() {
        TrainingRun run = localRun("expA_v2_i-0abc123", T);
        TrackerRun far = trackerRun("t1", "expA-v2-ip-10-0-0-1", T.plus(Duration.ofMinutes(20)));
        TrackerRun near = trackerRun("t2", "EXPA_V2-ip-10-0-0-2", T.minus(Duration.ofMinutes(2)));

        assertThat(matcher.match(run, List.of(far, near))).containsSame(near);
    }

    @Test
    void match_shouldSkipCandidatesWithoutNameOrTimestamp() {
        TrainingRun run = localRun("expA_v2_i-0abc123", T);

        Optional<TrackerRun> match = matcher.match(run, List.of(
                trackerRun("t1", null, T),
                trackerRun("t2", "expA-v2-ip-10-0-0-1", null)));

        assertThat(match).isEmpty();
    }

    @Test
    void configPrefix_shouldDropTrailingInstanceSegment() {
        assertThat(ConfigPrefixProximityMatcher.configPrefix("expA_v2_i-0abc123")).isEqualTo("expA_v2");
        assertThat(ConfigPrefixProximityMatcher.configPrefix("standalone")).isEqualTo("standalone");
    }

    private static TrainingRun localRun(String runId, Instant createdAt) {
        return TrainingRun.builder().runId(runId).createdAt(createdAt).build();
    }

    private static TrackerRun trackerRun(String id, String name, Instant createdAt) {
        return TrackerRun.builder().id(id).name(name).createdAt(createdAt).state("running").build();
    }
}
