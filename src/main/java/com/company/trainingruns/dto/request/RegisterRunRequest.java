package com.company.trainingruns.dto.request;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Registration sent by the launcher before the job starts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRunRequest {
    @NotBlank(message = "Run ID is required")
    @Size(max = 255)
    private String runId;

    // Usually unknown at launch; filled in by reconciliation
    private String externalRunId;
    private String displayName;

    private String configFilePath;
    private String host;          // e.g. ec2, expanse
    private String infraHostId;   // e.g. EC2 instance id
    private String chainOfCustodyId;

    // Full launch config document, stored verbatim
    private JsonNode config;

    @Valid
    @Builder.Default
    private List<ObjectiveConfig> objectives = new ArrayList<>();
}
