package com.labframe.notifications.controller;

import com.labframe.notifications.model.dto.ParameterValueView;
import com.labframe.notifications.model.dto.RecordParametersRequest;
import com.labframe.notifications.service.ParameterValueService;
import com.labframe.notifications.service.ProjectResolver;
import com.labframe.notifications.service.realtime.ChangeDetectorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Records parameter values and reads their history. Every recorded value is
 * picked up by the change poller on its next tick.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SampleParameterController {

    private final ParameterValueService parameterValueService;
    private final ChangeDetectorRegistry detectorRegistry;
    private final ProjectResolver projectResolver;

    @PostMapping("/samples/{sampleId}/parameters")
    public ResponseEntity<Map<String, Object>> recordParameters(
            @PathVariable long sampleId,
            @RequestBody RecordParametersRequest request,
            @RequestParam(value = "project", required = false) String project,
            @RequestHeader(value = "X-Project", required = false) String headerProject) {
        String projectName = projectResolver.resolve(project, headerProject);
        detectorRegistry.ensureRegistered(projectName);
        try {
            int recorded = parameterValueService.recordParameters(projectName, sampleId, request.getParameters());
            return ResponseEntity.ok(Map.of("project", projectName, "sampleId", sampleId, "recorded", recorded));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected parameter values for sample {} in project '{}': {}", sampleId, projectName, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("detail", e.getMessage()));
        } catch (Exception e) {
            log.error("❌ Error recording parameter values for sample {} in project '{}'", sampleId, projectName, e);
            return ResponseEntity.status(500).body(Map.of("detail", "Recording failed: " + e.getMessage()));
        }
    }

    @GetMapping("/parameters/{parameterName}/history")
    public ResponseEntity<List<ParameterValueView>> parameterHistory(
            @PathVariable String parameterName,
            @RequestParam(value = "limit", defaultValue = "25") int limit,
            @RequestParam(value = "project", required = false) String project,
            @RequestHeader(value = "X-Project", required = false) String headerProject) {
        String projectName = projectResolver.resolve(project, headerProject);
        detectorRegistry.ensureRegistered(projectName);
        try {
            return ResponseEntity.ok(parameterValueService.history(projectName, parameterName, limit));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected history request for '{}': {}", parameterName, e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }
}
