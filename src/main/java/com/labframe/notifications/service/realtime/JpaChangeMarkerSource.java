package com.labframe.notifications.service.realtime;

import com.labframe.notifications.repository.ParameterValueRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Uses the ids of recorded parameter values as change markers and parameter
 * names as topics.
 */
@Component
@RequiredArgsConstructor
public class JpaChangeMarkerSource implements ChangeMarkerSource {

    private final ParameterValueRepository parameterValueRepository;

    @Override
    public long currentChangeMarker(String project) {
        return parameterValueRepository.findMaxIdByProject(project);
    }

    @Override
    public List<String> topicsChangedSince(String project, long marker, long upTo) {
        return parameterValueRepository.findParameterNamesChangedBetween(project, marker, upTo);
    }
}
