package com.company.trainingruns.reconciliation;

import com.company.trainingruns.config.TrainingRunProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-invocation knobs. A dry run computes every outcome but writes nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationOptions {
    private int limit;
    private boolean dryRun;
    private boolean markStale;

    public static ReconciliationOptions defaults(TrainingRunProperties properties) {
        return ReconciliationOptions.builder()
                .limit(properties.getReconciliation().getBatchLimit())
                .dryRun(false)
                .markStale(properties.getReconciliation().isMarkStale())
                .build();
    }
}
