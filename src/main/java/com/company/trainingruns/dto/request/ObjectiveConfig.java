package com.company.trainingruns.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the launch config's {@code objectives} list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectiveConfig {
    @NotBlank(message = "Objective name is required")
    private String name;

    private String alias;
    private String uniprot;

    @Pattern(regexp = "(?i)maximize|minimize", message = "Direction must be maximize or minimize")
    private String direction;

    private Double weight;
}
