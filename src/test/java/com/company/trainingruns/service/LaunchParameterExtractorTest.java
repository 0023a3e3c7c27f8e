package com.company.trainingruns.service;

import com.company.trainingruns.domain.LaunchParameters;
import com.company.trainingruns.exception.MalformedDataException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LaunchParameterExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LaunchParameterExtractor extractor = new LaunchParameterExtractor();

    @Test
    void extract_shouldTakeValuesVerbatimAndLeaveAbsentFieldsNull() throws Exception {
        LaunchParameters params = extractor.extract(objectMapper.readTree("""
                {
                  "training": {"batch_size": 0, "learning_rate": 1e-5, "bf16": true},
                  "reward": {"gradient_method": "reinforce", "beta": 0.0},
                  "grouping": {"n_clusters": 4},
                  "objectives": [{"name": "A"}, {"name": "B"}],
                  "generation": {"scaffolds": ["c1ccccc1"]}
                }
                """));

        assertThat(params.getBatchSize()).isZero();
        assertThat(params.getLearningRate()).isEqualTo(1e-5);
        assertThat(params.getBf16()).isTrue();
        assertThat(params.getBeta()).isZero();
        assertThat(params.getGradientMethod()).isEqualTo("reinforce");
        assertThat(params.getClusterCount()).isEqualTo(4);
        assertThat(params.getNumObjectives()).isEqualTo(2);
        assertThat(params.getNumScaffolds()).isEqualTo(1);
        assertThat(params.getMaxSteps()).isNull();
        assertThat(params.getFp16()).isNull();
        assertThat(params.getNumGpus()).isNull();
    }

    @Test
    void extract_numGpus_shouldFallBackToDistributedSection() throws Exception {
        LaunchParameters params = extractor.extract(objectMapper.readTree("""
                {"distributed": {"num_processes": 8}}
                """));

        assertThat(params.getNumGpus()).isEqualTo(8);
    }

    @Test
    void extract_wrongType_shouldBeMalformed() throws Exception {
        assertThatThrownBy(() -> extractor.extract(objectMapper.readTree("""
                {"training": {"batch_size": "32"}}
                """)))
                .isInstanceOf(MalformedDataException.class)
                .hasMessageContaining("training.batch_size");
    }

    @Test
    void extract_missingConfig_shouldReturnEmptyParameters() {
        LaunchParameters params = extractor.extract(null);

        assertThat(params.getBatchSize()).isNull();
        assertThat(params.getGradientMethod()).isNull();
    }
}
