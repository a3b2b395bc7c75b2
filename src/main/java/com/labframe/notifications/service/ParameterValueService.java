package com.labframe.notifications.service;

import com.labframe.notifications.model.domain.ParameterDefinition;
import com.labframe.notifications.model.domain.ParameterValue;
import com.labframe.notifications.model.dto.ParameterValueView;
import com.labframe.notifications.model.dto.RecordParametersRequest.ParameterAssignment;
import com.labframe.notifications.repository.ParameterDefinitionRepository;
import com.labframe.notifications.repository.ParameterValueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Records parameter values for samples and reads a parameter's history.
 * Parameter definitions are created on first use.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParameterValueService {

    static final int MAX_HISTORY = 200;

    private final ParameterDefinitionRepository parameterDefinitionRepository;
    private final ParameterValueRepository parameterValueRepository;

    @Transactional
    public int recordParameters(String project, long sampleId, List<ParameterAssignment> assignments) {
        if (assignments == null || assignments.isEmpty()) {
            throw new IllegalArgumentException("At least one parameter is required");
        }
        for (ParameterAssignment assignment : assignments) {
            if (!StringUtils.hasText(assignment.getName())) {
                throw new IllegalArgumentException("Parameter name must not be blank");
            }
        }

        for (ParameterAssignment assignment : assignments) {
            ParameterDefinition definition = findOrCreateDefinition(project, assignment.getName().trim());
            parameterValueRepository.save(new ParameterValue(
                    project, sampleId, definition, assignment.getValue(), assignment.getUnit()));
        }
        log.info("Recorded {} parameter values for sample {} in project '{}'", assignments.size(), sampleId, project);
        return assignments.size();
    }

    @Transactional(readOnly = true)
    public List<ParameterValueView> history(String project, String parameterName, int limit) {
        if (limit < 1 || limit > MAX_HISTORY) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY);
        }
        return parameterValueRepository.findHistory(project, parameterName, PageRequest.of(0, limit)).stream()
                .map(value -> new ParameterValueView(
                        value.getId(),
                        value.getSampleId(),
                        value.getDefinition().getName(),
                        value.getValue(),
                        value.getUnit(),
                        value.getRecordedAt()))
                .toList();
    }

    private ParameterDefinition findOrCreateDefinition(String project, String name) {
        return parameterDefinitionRepository.findByProjectAndName(project, name)
                .orElseGet(() -> {
                    log.debug("Creating parameter definition '{}' in project '{}'", name, project);
                    return parameterDefinitionRepository.save(new ParameterDefinition(project, name));
                });
    }
}
