package com.company.trainingruns.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStats {
    private long totalRuns;
    private long launched;
    private long running;
    private long notRunning;
    private long withHistory;
    private long withBlogPosts;
    private long withCrashReports;
    private long withCrashAnalysis;
}
