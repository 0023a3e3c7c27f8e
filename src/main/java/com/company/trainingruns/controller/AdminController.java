package com.company.trainingruns.controller;

import com.company.trainingruns.dto.request.CorrectExternalIdRequest;
import com.company.trainingruns.service.RunRegistrationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual corrections. Every call is logged with the acting principal.
 */
@RestController
@RequestMapping("/api/v1/admin/runs")
@Tag(name = "Admin", description = "Manual run corrections")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class AdminController {

    private final RunRegistrationService registrationService;

    @PutMapping("/{runId}/external-id")
    @Operation(summary = "Overwrite a run's tracker id", description = "For runs the matcher linked to the wrong tracker record")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> correctExternalId(@PathVariable String runId,
                                                  @Valid @RequestBody CorrectExternalIdRequest request) {
        registrationService.correctExternalRunId(runId, request.getExternalRunId(), request.getReason());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{runId}")
    @Operation(summary = "Delete a run and its objectives")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Void> deleteRun(@PathVariable String runId) {
        registrationService.deleteRun(runId);
        return ResponseEntity.noContent().build();
    }
}
