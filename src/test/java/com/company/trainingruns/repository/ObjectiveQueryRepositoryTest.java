package com.company.trainingruns.repository;

import com.company.trainingruns.domain.GradientMethodComparison;
import com.company.trainingruns.domain.LaunchParameters;
import com.company.trainingruns.domain.ObjectiveBound;
import com.company.trainingruns.domain.ObjectiveQuery;
import com.company.trainingruns.domain.ObjectiveStatistics;
import com.company.trainingruns.domain.RunObjective;
import com.company.trainingruns.domain.RunUpdate;
import com.company.trainingruns.domain.TrainingRun;
import com.company.trainingruns.domain.enums.ObjectiveDirection;
import com.company.trainingruns.domain.enums.ObjectiveMetric;
import com.company.trainingruns.domain.enums.RunStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ObjectiveQueryRepositoryTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private TrainingRunRepository runRepository;
    private RunObjectiveRepository objectiveRepository;
    private ObjectiveQueryRepository queryRepository;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        jdbcTemplate = new JdbcTemplate(database);
        runRepository = new TrainingRunRepository(jdbcTemplate, Clock.systemUTC());
        objectiveRepository = new RunObjectiveRepository(jdbcTemplate, Clock.systemUTC());
        queryRepository = new ObjectiveQueryRepository(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void findByObjectives_shouldRequireEveryBound() {
        givenRun("R1", null, RunStatus.NOT_RUNNING, null);
        givenRun("R2", null, RunStatus.NOT_RUNNING, null);
        givenObjective("R1", "A", 0.85);
        givenObjective("R1", "B", 0.75);
        givenObjective("R2", "A", 0.9);
        givenObjective("R2", "B", 0.5);

        List<TrainingRun> runs = queryRepository.findByObjectives(ObjectiveQuery.builder()
                .objective("A", ObjectiveBound.atLeast(0.8))
                .objective("B", ObjectiveBound.atLeast(0.7))
                .build());

        assertThat(runs).extracting(TrainingRun::getRunId).containsExactly("R1");
    }

    @Test
    void findByObjectives_shouldReturnEachRunOnce() {
        givenRun("R1", null, RunStatus.NOT_RUNNING, null);
        givenRun("R2", null, RunStatus.RUNNING, null);
        givenObjective("R1", "A", 0.85);
        givenObjective("R1", "B", 0.75);
        givenObjective("R2", "A", 0.9);

        List<TrainingRun> all = queryRepository.findByObjectives(ObjectiveQuery.builder()
                .objective("A", null)
                .build());
        List<TrainingRun> stopped = queryRepository.findByObjectives(ObjectiveQuery.builder()
                .objective("A", ObjectiveBound.between(0.0, 1.0))
                .status(RunStatus.NOT_RUNNING)
                .build());

        assertThat(all).extracting(TrainingRun::getRunId).containsExactlyInAnyOrder("R1", "R2");
        assertThat(stopped).extracting(TrainingRun::getRunId).containsExactly("R1");
    }

    @Test
    void findByObjectives_shouldFilterOnChosenMetric() {
        givenRun("R1", null, RunStatus.NOT_RUNNING, null);
        givenObjective("R1", "A", 0.85);
        objectiveRepository.updateMetrics("R1", "A", metrics(ObjectiveMetric.NORMALIZED_MEAN, 0.2));

        List<TrainingRun> runs = queryRepository.findByObjectives(ObjectiveQuery.builder()
                .objective("A", ObjectiveBound.atLeast(0.5))
                .metric(ObjectiveMetric.NORMALIZED_MEAN)
                .build());

        assertThat(runs).isEmpty();
    }

    @Test
    void findByObjectives_withoutObjectives_shouldReturnEmpty() {
        givenRun("R1", null, RunStatus.NOT_RUNNING, null);

        assertThat(queryRepository.findByObjectives(ObjectiveQuery.builder().build())).isEmpty();
    }

    @Test
    void getStatistics_shouldAggregateRawMean() {
        givenRun("R1", "reinforce", RunStatus.NOT_RUNNING, 3600);
        givenRun("R2", "reinforce", RunStatus.NOT_RUNNING, 3600);
        givenRun("R3", "reinforce", RunStatus.RUNNING, 3600);
        givenObjective("R1", "COMT_activity", 0.6);
        givenObjective("R2", "COMT_activity", 0.8);
        givenObjective("R3", "COMT_activity", 0.1);
        objectiveRepository.updateMetrics("R1", "COMT_activity", metrics(ObjectiveMetric.RAW_STD, 0.1));
        objectiveRepository.updateMetrics("R2", "COMT_activity", metrics(ObjectiveMetric.RAW_STD, 0.3));

        ObjectiveStatistics stats = queryRepository.getStatistics("COMT_activity", null, RunStatus.NOT_RUNNING);

        assertThat(stats.getCount()).isEqualTo(2);
        assertThat(stats.getMean()).isCloseTo(0.7, within(1e-9));
        assertThat(stats.getMin()).isCloseTo(0.6, within(1e-9));
        assertThat(stats.getMax()).isCloseTo(0.8, within(1e-9));
        assertThat(stats.getAvgStd()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void getStatistics_withNoRows_shouldReturnZeroCountAndNulls() {
        ObjectiveStatistics stats = queryRepository.getStatistics("unknown", null, null);

        assertThat(stats.getCount()).isZero();
        assertThat(stats.getMean()).isNull();
    }

    @Test
    void compareGradientMethods_shouldOrderByAverageDescending() {
        givenRun("R1", "reinforce", RunStatus.NOT_RUNNING, 3600);
        givenRun("R2", "reinforce", RunStatus.NOT_RUNNING, 7200);
        givenRun("R3", "dpo", RunStatus.NOT_RUNNING, 3600);
        givenRun("R4", "dpo", RunStatus.NOT_RUNNING, 3600);
        givenRun("R5", "dpo", RunStatus.RUNNING, 3600);
        givenRun("R6", null, RunStatus.NOT_RUNNING, 3600);
        givenObjective("R1", "COMT_activity", 0.6);
        givenObjective("R2", "COMT_activity", 0.8);
        givenObjective("R3", "COMT_activity", 0.9);
        givenObjective("R4", "COMT_activity", 0.7);
        givenObjective("R5", "COMT_activity", 0.0);
        givenObjective("R6", "COMT_activity", 1.0);

        List<GradientMethodComparison> rows =
                queryRepository.compareGradientMethods("COMT_activity", RunStatus.NOT_RUNNING);

        assertThat(rows).extracting(GradientMethodComparison::getGradientMethod)
                .containsExactly("dpo", "reinforce");

        GradientMethodComparison dpo = rows.get(0);
        assertThat(dpo.getCount()).isEqualTo(2);
        assertThat(dpo.getAvg()).isCloseTo(0.8, within(1e-9));
        assertThat(dpo.getBest()).isCloseTo(0.9, within(1e-9));
        assertThat(dpo.getWorst()).isCloseTo(0.7, within(1e-9));
        assertThat(dpo.getAvgDurationHours()).isCloseTo(1.0, within(1e-9));

        GradientMethodComparison reinforce = rows.get(1);
        assertThat(reinforce.getCount()).isEqualTo(2);
        assertThat(reinforce.getAvg()).isCloseTo(0.7, within(1e-9));
        assertThat(reinforce.getBest()).isCloseTo(0.8, within(1e-9));
        assertThat(reinforce.getWorst()).isCloseTo(0.6, within(1e-9));
        assertThat(reinforce.getAvgDurationHours()).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void statusFilteredQueries_shouldTreatLegacyCompletedRowsAsNotRunning() {
        givenRun("L1", "dpo", RunStatus.NOT_RUNNING, 3600);
        givenObjective("L1", "COMT_activity", 0.75);
        jdbcTemplate.update("UPDATE training_runs SET status = 'completed' WHERE run_id = 'L1'");
        RunStatus requested = RunStatus.fromDatabase("completed");

        List<GradientMethodComparison> rows = queryRepository.compareGradientMethods("COMT_activity", requested);
        ObjectiveStatistics stats = queryRepository.getStatistics("COMT_activity", null, requested);
        List<TrainingRun> matches = queryRepository.findByObjectives(ObjectiveQuery.builder()
                .objective("COMT_activity", ObjectiveBound.atLeast(0.5))
                .status(requested)
                .build());

        assertThat(rows).extracting(GradientMethodComparison::getGradientMethod).containsExactly("dpo");
        assertThat(stats.getCount()).isEqualTo(1);
        assertThat(matches).extracting(TrainingRun::getRunId).containsExactly("L1");
    }

    private void givenRun(String runId, String gradientMethod, RunStatus status, Integer durationSeconds) {
        runRepository.insert(TrainingRun.builder()
                .runId(runId)
                .host("ec2")
                .launchParameters(LaunchParameters.builder().gradientMethod(gradientMethod).build())
                .build());
        RunUpdate update = RunUpdate.empty();
        if (durationSeconds != null) {
            update.durationSeconds(durationSeconds);
        }
        runRepository.updateStatus(runId, status, update);
    }

    private void givenObjective(String runId, String name, double rawMean) {
        objectiveRepository.insert(RunObjective.builder()
                .runId(runId)
                .objectiveName(name)
                .objectiveAlias(name + "_maximize")
                .direction(ObjectiveDirection.MAXIMIZE)
                .weight(1.0)
                .rawMean(rawMean)
                .build());
    }

    private static Map<ObjectiveMetric, Double> metrics(ObjectiveMetric metric, double value) {
        Map<ObjectiveMetric, Double> values = new EnumMap<>(ObjectiveMetric.class);
        values.put(metric, value);
        return values;
    }
}
