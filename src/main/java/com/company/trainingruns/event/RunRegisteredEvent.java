package com.company.trainingruns.event;

import com.company.trainingruns.domain.TrainingRun;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RunRegisteredEvent {
    private final TrainingRun run;
}
