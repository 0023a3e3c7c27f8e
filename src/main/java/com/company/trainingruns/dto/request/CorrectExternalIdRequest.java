package com.company.trainingruns.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorrectExternalIdRequest {
    @NotBlank(message = "External run ID is required")
    private String externalRunId;

    // Free text kept in the audit log line
    private String reason;
}
