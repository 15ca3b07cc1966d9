package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.model.CustomerProfile;
import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.Journey;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.JourneyStatus;
import com.journeytide.model.WaitingForEvent;
import com.journeytide.model.graph.JourneySettings;
import com.journeytide.repository.CustomerProfileRepository;
import com.journeytide.repository.JourneyRepository;
import com.journeytide.repository.SegmentRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.journeytide.service.JourneyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EnrollmentManagerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T09:00:00Z");
    private static final String PHONE = "+15551234567";

    @Mock private MessagingGateway messagingGateway;
    @Mock private SegmentRepository segmentRepository;
    @Mock private CustomerProfileRepository customerProfileRepository;
    @Mock private ProfileUpdater profileUpdater;
    @Mock private LeaseService leaseService;
    @Mock private LeaseService walkLeases;
    @Mock private JourneyRepository journeyRepository;

    private InMemoryEnrollmentStore store;
    private JourneyEngineProperties properties;
    private EnrollmentManager manager;
    private Journey journey;
    private final EnrollmentCandidate candidate = new EnrollmentCandidate("cust-1", PHONE);

    @BeforeEach
    void setUp() {
        store = new InMemoryEnrollmentStore();
        properties = new JourneyEngineProperties();
        MutableClock clock = new MutableClock(NOW);
        NodeGraphWalker walker = new NodeGraphWalker(store, messagingGateway, new ConditionGroupEvaluator(clock),
                segmentRepository, customerProfileRepository, profileUpdater, new VariantAllocator(), walkLeases,
                properties, clock);
        lenient().when(walkLeases.acquire(anyString(), any(Duration.class))).thenReturn(Optional.of("walk-token"));
        manager = new EnrollmentManager(store, walker, leaseService, journeyRepository, customerProfileRepository,
                properties, clock);

        journey = journey(List.of(trigger("t"), goal("g")), List.of(edge("t", "g")));
    }

    private void leaseGranted() {
        when(leaseService.acquire(eq(LeaseService.enrollmentKey(journey.getId(), "cust-1")), any(Duration.class)))
                .thenReturn(Optional.of("token-1"));
    }

    private JourneyEnrollment priorRun(EnrollmentStatus status, Instant finishedAt) {
        JourneyEnrollment prior = JourneyEnrollment.start(journey.getId(), "cust-1", PHONE, "t",
                finishedAt.minus(Duration.ofHours(1)));
        switch (status) {
            case COMPLETED -> prior.complete(finishedAt);
            case EXITED -> prior.exit("exit_node", finishedAt);
            case FAILED -> prior.fail("send_failed", finishedAt);
            case WAITING -> prior.park(WaitingForEvent.messageCallback(), finishedAt);
            case ACTIVE -> { }
        }
        return store.seed(prior);
    }

    @Test
    @DisplayName("Eligible customer is enrolled, walked and the lease released")
    void eligibleCustomer_isEnrolled() {
        leaseGranted();

        EnrollmentOutcome outcome = manager.tryEnroll(journey, candidate, WalkMode.LIVE);

        assertTrue(outcome.isEnrolled());
        assertEquals(EnrollmentStatus.COMPLETED, outcome.getAdvance().getStatus());
        UUID id = outcome.getAdvance().getEnrollment().getId();
        assertEquals("journey_started", store.actions(id).get(0));
        assertEquals(EnrollmentStatus.COMPLETED, store.get(id).getStatus());
        verify(leaseService).release(LeaseService.enrollmentKey(journey.getId(), "cust-1"), "token-1");
    }

    @Test
    @DisplayName("Inactive journey admits nobody")
    void draftJourney_skipped() {
        journey.setStatus(JourneyStatus.DRAFT);

        EnrollmentOutcome outcome = manager.tryEnroll(journey, candidate, WalkMode.LIVE);

        assertFalse(outcome.isEnrolled());
        assertEquals(SkipReason.JOURNEY_NOT_ACTIVE, outcome.getSkipReason());
        verifyNoInteractions(leaseService);
    }

    @Test
    @DisplayName("Journey without trigger node admits nobody")
    void noTrigger_skipped() {
        journey.setNodes(new ArrayList<>(List.of(goal("g"))));

        assertEquals(SkipReason.NO_TRIGGER_NODE, manager.tryEnroll(journey, candidate, WalkMode.LIVE).getSkipReason());
    }

    @Test
    @DisplayName("Lease held by another instance skips the candidate")
    void leaseHeld_skipped() {
        when(leaseService.acquire(anyString(), any(Duration.class))).thenReturn(Optional.empty());

        EnrollmentOutcome outcome = manager.tryEnroll(journey, candidate, WalkMode.LIVE);

        assertEquals(SkipReason.CONCURRENT_ENROLLMENT, outcome.getSkipReason());
        assertEquals(0, store.size());
        verify(leaseService, never()).release(anyString(), anyString());
    }

    @Nested
    @DisplayName("Re-entry")
    class Reentry {

        @Test
        @DisplayName("Open enrollment blocks a second one")
        void openEnrollment_blocks() {
            priorRun(EnrollmentStatus.WAITING, NOW.minus(Duration.ofMinutes(5)));

            assertEquals(SkipReason.ALREADY_ENROLLED, manager.tryEnroll(journey, candidate, WalkMode.LIVE).getSkipReason());
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("Finished run blocks when re-entry is off")
        void finishedRun_blocksWithoutReentry() {
            priorRun(EnrollmentStatus.COMPLETED, NOW.minus(Duration.ofDays(30)));

            assertEquals(SkipReason.REENTRY_NOT_ALLOWED,
                    manager.tryEnroll(journey, candidate, WalkMode.LIVE).getSkipReason());
        }

        @Test
        @DisplayName("Cooldown is measured from the latest finished run")
        void cooldown_measuredFromLatestRun() {
            journey.setSettings(JourneySettings.builder().allowReentry(true).reentryCooldownDays(7).build());
            priorRun(EnrollmentStatus.EXITED, NOW.minus(Duration.ofDays(20)));
            priorRun(EnrollmentStatus.COMPLETED, NOW.minus(Duration.ofDays(3)));

            assertEquals(SkipReason.COOLDOWN_NOT_ELAPSED,
                    manager.tryEnroll(journey, candidate, WalkMode.LIVE).getSkipReason());
        }

        @Test
        @DisplayName("Elapsed cooldown admits the customer again")
        void elapsedCooldown_admits() {
            journey.setSettings(JourneySettings.builder().allowReentry(true).reentryCooldownDays(7).build());
            priorRun(EnrollmentStatus.COMPLETED, NOW.minus(Duration.ofDays(8)));
            leaseGranted();

            assertTrue(manager.tryEnroll(journey, candidate, WalkMode.LIVE).isEnrolled());
            assertEquals(2, store.size());
        }

        @Test
        @DisplayName("Failed runs never block re-entry")
        void failedRun_neverBlocks() {
            priorRun(EnrollmentStatus.FAILED, NOW.minus(Duration.ofMinutes(1)));
            leaseGranted();

            assertTrue(manager.tryEnroll(journey, candidate, WalkMode.LIVE).isEnrolled());
        }
    }

    @Nested
    @DisplayName("Test mode")
    class TestMode {

        @BeforeEach
        void testModeOn() {
            journey.setSettings(JourneySettings.builder()
                    .testMode(true)
                    .testPhoneNumbers(List.of("+1 (555) 123-4567"))
                    .build());
        }

        @Test
        @DisplayName("Test phone matches after normalization")
        void testPhone_admitted() {
            leaseGranted();

            assertTrue(manager.tryEnroll(journey, candidate, WalkMode.LIVE).isEnrolled());
        }

        @Test
        @DisplayName("Customers outside the test audience are excluded")
        void outsider_excluded() {
            EnrollmentCandidate outsider = new EnrollmentCandidate("cust-9", "+15559999999");

            assertEquals(SkipReason.TEST_MODE_EXCLUDED,
                    manager.tryEnroll(journey, outsider, WalkMode.LIVE).getSkipReason());
        }

        @Test
        @DisplayName("Globally configured test customers are admitted")
        void globalTestCustomer_admitted() {
            properties.getTest().setCustomerIds(List.of("cust-9"));
            when(leaseService.acquire(anyString(), any(Duration.class))).thenReturn(Optional.of("token-9"));

            assertTrue(manager.tryEnroll(journey, new EnrollmentCandidate("cust-9", null), WalkMode.LIVE).isEnrolled());
        }
    }

    @Test
    @DisplayName("Dry run walks without lease or persistence")
    void dryRun_persistsNothing() {
        EnrollmentOutcome outcome = manager.tryEnroll(journey, candidate, WalkMode.DRY_RUN);

        assertTrue(outcome.isEnrolled());
        assertEquals(EnrollmentStatus.COMPLETED, outcome.getAdvance().getStatus());
        assertEquals("journey_started", outcome.getAdvance().getEntries().get(0).getAction());
        assertEquals(0, store.size());
        verifyNoInteractions(leaseService);
    }

    @Test
    @DisplayName("Manual enrollment looks up the phone from the profile")
    void manualEnrollment_resolvesPhone() {
        when(journeyRepository.findById(journey.getId())).thenReturn(Optional.of(journey));
        when(customerProfileRepository.findById("cust-1"))
                .thenReturn(Optional.of(CustomerProfile.builder().id("cust-1").phone(PHONE).build()));
        leaseGranted();

        EnrollmentOutcome outcome = manager.enrollManually(journey.getId(), "cust-1", null);

        assertTrue(outcome.isEnrolled());
        assertEquals(PHONE, outcome.getAdvance().getEnrollment().getCustomerPhone());
    }

    @Test
    @DisplayName("Manual enrollment into an unknown journey is rejected")
    void manualEnrollment_unknownJourney() {
        UUID unknown = UUID.randomUUID();
        when(journeyRepository.findById(unknown)).thenReturn(Optional.empty());

        assertThrows(EntityNotFoundException.class, () -> manager.enrollManually(unknown, "cust-1", PHONE));
    }
}
