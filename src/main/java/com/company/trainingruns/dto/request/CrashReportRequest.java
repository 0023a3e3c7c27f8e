package com.company.trainingruns.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrashReportRequest {
    private String errorLogS3Key;
    private String crashReportS3Key;
    private String crashAnalysisS3Key;
}
