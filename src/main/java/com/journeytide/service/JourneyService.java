package com.journeytide.service;

import com.journeytide.dto.EnrollmentResponse;
import com.journeytide.dto.JourneyRequest;
import com.journeytide.dto.JourneyResponse;
import com.journeytide.model.Journey;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.JourneyStatus;
import com.journeytide.model.graph.AbTestNode;
import com.journeytide.model.graph.JourneyNode;
import com.journeytide.model.graph.JourneySettings;
import com.journeytide.model.graph.NodeType;
import com.journeytide.repository.JourneyRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class JourneyService {

    private final JourneyRepository journeyRepository;
    private final EnrollmentStore enrollmentStore;
    private final JourneyValidator journeyValidator;
    private final VariantAllocator variantAllocator;

    @Transactional
    public JourneyResponse create(JourneyRequest request) {
        Journey journey = Journey.builder()
                .name(request.getName())
                .description(request.getDescription())
                .storeId(request.getStoreId())
                .status(request.getStatus() != null ? request.getStatus() : JourneyStatus.DRAFT)
                .nodes(prepareNodes(request.getNodes()))
                .edges(request.getEdges() != null ? new ArrayList<>(request.getEdges()) : new ArrayList<>())
                .settings(request.getSettings() != null ? request.getSettings() : new JourneySettings())
                .build();

        if (journey.isActive()) {
            journeyValidator.validate(journey);
        }

        Journey saved = journeyRepository.save(journey);
        log.info("Journey created: journeyId={}, name='{}', status={}", saved.getId(), saved.getName(), saved.getStatus());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<JourneyResponse> listAll(String storeId) {
        List<Journey> journeys = storeId != null
                ? journeyRepository.findByStoreId(storeId)
                : journeyRepository.findAll();
        return journeys.stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public JourneyResponse getById(UUID id) {
        return toResponse(find(id));
    }

    @Transactional
    public JourneyResponse update(UUID id, JourneyRequest request) {
        Journey journey = find(id);

        journey.setName(request.getName());
        journey.setDescription(request.getDescription());
        journey.setStoreId(request.getStoreId());
        if (request.getStatus() != null) {
            journey.setStatus(request.getStatus());
        }
        journey.setNodes(prepareNodes(request.getNodes()));
        journey.setEdges(request.getEdges() != null ? new ArrayList<>(request.getEdges()) : new ArrayList<>());
        journey.setSettings(request.getSettings() != null ? request.getSettings() : new JourneySettings());

        if (journey.isActive()) {
            journeyValidator.validate(journey);
        }

        Journey saved = journeyRepository.save(journey);
        log.info("Journey updated: journeyId={}, status={}", saved.getId(), saved.getStatus());
        return toResponse(saved);
    }

    /**
     * Active journeys must be paused first. Enrollments are kept.
     */
    @Transactional
    public void delete(UUID id) {
        Journey journey = find(id);
        if (journey.isActive()) {
            throw new IllegalStateException("Pause journey " + id + " before deleting it");
        }
        journeyRepository.delete(journey);
        log.info("Journey deleted: journeyId={}", id);
    }

    @Transactional
    public JourneyResponse changeStatus(UUID id, JourneyStatus status) {
        Journey journey = find(id);
        if (status == JourneyStatus.ACTIVE) {
            journeyValidator.validate(journey);
        }
        journey.setStatus(status);
        log.info("Journey status changed: journeyId={}, status={}", id, status);
        return toResponse(journeyRepository.save(journey));
    }

    @Transactional(readOnly = true)
    public List<EnrollmentResponse> listEnrollments(UUID journeyId) {
        find(journeyId);
        return enrollmentStore.findByJourney(journeyId).stream()
                .map(JourneyService::toEnrollmentResponse)
                .collect(Collectors.toList());
    }

    private Journey find(UUID id) {
        return journeyRepository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Journey not found: " + id));
    }

    /**
     * Experiment weights are stored normalized so the walker can use them as is.
     */
    private List<JourneyNode> prepareNodes(List<JourneyNode> nodes) {
        if (nodes == null) {
            return new ArrayList<>();
        }
        for (JourneyNode node : nodes) {
            if (node.getType() == NodeType.ABTEST) {
                AbTestNode experiment = (AbTestNode) node;
                experiment.setVariants(variantAllocator.normalizeWeights(experiment.getVariants()));
            }
        }
        return new ArrayList<>(nodes);
    }

    // --- Mapping helpers ---

    private JourneyResponse toResponse(Journey j) {
        return JourneyResponse.builder()
                .id(j.getId())
                .name(j.getName())
                .description(j.getDescription())
                .storeId(j.getStoreId())
                .status(j.getStatus())
                .nodes(j.getNodes())
                .edges(j.getEdges())
                .settings(j.getSettings())
                .createdAt(j.getCreatedAt())
                .updatedAt(j.getUpdatedAt())
                .build();
    }

    public static EnrollmentResponse toEnrollmentResponse(JourneyEnrollment e) {
        return EnrollmentResponse.builder()
                .id(e.getId())
                .journeyId(e.getJourneyId())
                .customerId(e.getCustomerId())
                .customerPhone(e.getCustomerPhone())
                .currentNodeId(e.getCurrentNodeId())
                .status(e.getStatus())
                .exitReason(e.getExitReason())
                .waitingFor(e.getWaitingForEvent() != null ? e.getWaitingForEvent().getType() : null)
                .waitingUntil(e.getWaitingForEvent() != null ? e.getWaitingForEvent().getTimeoutAt() : null)
                .metadata(e.getMetadata())
                .experiments(e.getExperiments())
                .startedAt(e.getStartedAt())
                .lastActivityAt(e.getLastActivityAt())
                .completedAt(e.getCompletedAt())
                .build();
    }
}
