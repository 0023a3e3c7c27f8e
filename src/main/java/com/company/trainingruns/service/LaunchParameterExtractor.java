package com.company.trainingruns.service;

import com.company.trainingruns.domain.LaunchParameters;
import com.company.trainingruns.exception.MalformedDataException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/**
 * Lifts queryable hyperparameters out of a launch config document.
 * <p>
 * Values are taken verbatim. A missing or null field yields null, never a default;
 * a field of the wrong JSON type is rejected.
 */
@Component
public class LaunchParameterExtractor {

    public LaunchParameters extract(JsonNode config) {
        if (config == null || config.isNull() || config.isMissingNode()) {
            return new LaunchParameters();
        }
        if (!config.isObject()) {
            throw new MalformedDataException("Launch config must be a JSON object");
        }

        JsonNode training = section(config, "training");
        JsonNode reward = section(config, "reward");
        JsonNode grouping = section(config, "grouping");
        JsonNode distributed = section(config, "distributed");
        JsonNode generation = section(config, "generation");

        Integer numGpus = intValue(training, "training", "num_processes");
        if (numGpus == null) {
            numGpus = intValue(distributed, "distributed", "num_processes");
        }

        return LaunchParameters.builder()
                .batchSize(intValue(training, "training", "batch_size"))
                .learningRate(doubleValue(training, "training", "learning_rate"))
                .gradientAccumulationSteps(intValue(training, "training", "gradient_accumulation_steps"))
                .maxSteps(intValue(training, "training", "max_steps"))
                .maxGradNorm(doubleValue(training, "training", "max_grad_norm"))
                .numGpus(numGpus)
                .mixedPrecision(booleanValue(training, "training", "mixed_precision"))
                .gradientCheckpointing(booleanValue(training, "training", "gradient_checkpointing"))
                .fp16(booleanValue(training, "training", "fp16"))
                .bf16(booleanValue(training, "training", "bf16"))
                .gradientMethod(textValue(reward, "reward", "gradient_method"))
                .beta(doubleValue(reward, "reward", "beta"))
                .enableMovingTargets(booleanValue(reward, "reward", "enable_moving_targets"))
                .returnGroups(booleanValue(grouping, "grouping", "return_groups"))
                .clusterCount(intValue(grouping, "grouping", "n_clusters"))
                .numObjectives(arraySize(config, null, "objectives"))
                .numScaffolds(arraySize(generation, "generation", "scaffolds"))
                .build();
    }

    private static JsonNode section(JsonNode config, String name) {
        JsonNode node = config.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new MalformedDataException("Config section '" + name + "' must be an object");
        }
        return node;
    }

    private static JsonNode field(JsonNode section, String name) {
        if (section == null) {
            return null;
        }
        JsonNode node = section.get(name);
        return node == null || node.isNull() ? null : node;
    }

    private static Integer intValue(JsonNode section, String sectionName, String name) {
        JsonNode node = field(section, name);
        if (node == null) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw malformed(sectionName, name, "an integer", node);
        }
        return node.intValue();
    }

    private static Double doubleValue(JsonNode section, String sectionName, String name) {
        JsonNode node = field(section, name);
        if (node == null) {
            return null;
        }
        if (!node.isNumber()) {
            throw malformed(sectionName, name, "a number", node);
        }
        return node.doubleValue();
    }

    private static Boolean booleanValue(JsonNode section, String sectionName, String name) {
        JsonNode node = field(section, name);
        if (node == null) {
            return null;
        }
        if (!node.isBoolean()) {
            throw malformed(sectionName, name, "a boolean", node);
        }
        return node.booleanValue();
    }

    private static String textValue(JsonNode section, String sectionName, String name) {
        JsonNode node = field(section, name);
        if (node == null) {
            return null;
        }
        if (!node.isTextual()) {
            throw malformed(sectionName, name, "a string", node);
        }
        return node.textValue();
    }

    private static Integer arraySize(JsonNode section, String sectionName, String name) {
        JsonNode node = field(section, name);
        if (node == null) {
            return null;
        }
        if (!node.isArray()) {
            throw malformed(sectionName, name, "an array", node);
        }
        return node.size();
    }

    private static MalformedDataException malformed(String section, String name, String expected, JsonNode actual) {
        String path = section != null ? section + "." + name : name;
        return new MalformedDataException("Config field '" + path + "' must be " + expected
                + " but was " + actual.getNodeType());
    }
}
