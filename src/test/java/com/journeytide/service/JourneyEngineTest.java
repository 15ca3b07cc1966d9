package com.journeytide.service;

import com.journeytide.config.JourneyEngineProperties;
import com.journeytide.dto.SimulationResult;
import com.journeytide.dto.SweepSummary;
import com.journeytide.model.CustomerProfile;
import com.journeytide.model.EnrollmentStatus;
import com.journeytide.model.Journey;
import com.journeytide.model.JourneyEnrollment;
import com.journeytide.model.JourneyStatus;
import com.journeytide.model.WaitType;
import com.journeytide.model.WaitingForEvent;
import com.journeytide.model.graph.ExitAction;
import com.journeytide.model.graph.JourneySettings;
import com.journeytide.model.graph.TriggerNode;
import com.journeytide.model.graph.TriggerType;
import com.journeytide.repository.CustomerProfileRepository;
import com.journeytide.repository.JourneyRepository;
import com.journeytide.repository.SegmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static com.journeytide.service.JourneyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives whole sweeps over real enrollment, walking and routing services.
 * Only the repositories, Redis, the trigger source and the gateway are mocked.
 */
@ExtendWith(MockitoExtension.class)
class JourneyEngineTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Mock private JourneyRepository journeyRepository;
    @Mock private CustomerProfileRepository customerProfileRepository;
    @Mock private SegmentRepository segmentRepository;
    @Mock private TriggerResolver triggerResolver;
    @Mock private LeaseService leaseService;
    @Mock private LeaseService walkLeases;
    @Mock private MessagingGateway messagingGateway;
    @Mock private DeduplicationService deduplicationService;
    @Mock private AnalyticsPublisher analyticsPublisher;
    @Mock private ProfileUpdater profileUpdater;

    private InMemoryEnrollmentStore store;
    private MutableClock clock;
    private JourneyEngineProperties properties;
    private JourneyEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryEnrollmentStore();
        clock = new MutableClock(START);
        properties = new JourneyEngineProperties();
        NodeGraphWalker walker = new NodeGraphWalker(store, messagingGateway, new ConditionGroupEvaluator(clock),
                segmentRepository, customerProfileRepository, profileUpdater, new VariantAllocator(), walkLeases,
                properties, clock);
        lenient().when(walkLeases.acquire(anyString(), any(Duration.class))).thenReturn(Optional.of("walk-token"));
        EnrollmentManager manager = new EnrollmentManager(store, walker, leaseService, journeyRepository,
                customerProfileRepository, properties, clock);
        ExitPathRouter router = new ExitPathRouter(store, journeyRepository, deduplicationService, analyticsPublisher,
                new TransitionWriter(store, profileUpdater), walker, clock);
        engine = new JourneyEngine(journeyRepository, customerProfileRepository, triggerResolver, manager, walker,
                router, store, leaseService, messagingGateway, properties, clock);

        lenient().when(leaseService.acquire(anyString(), any(Duration.class))).thenReturn(Optional.of("token"));
    }

    /** t(segment) → d(60 min) → g */
    private Journey delayedJourney() {
        return journey(List.of(trigger("t"), delayMinutes("d", 60), goal("g")),
                List.of(edge("t", "d"), edge("d", "g")));
    }

    private static TriggerNode manualTrigger() {
        return TriggerNode.builder().id("t").subtype(TriggerType.MANUAL_ENTRY).build();
    }

    private void activeJourneys(Journey... journeys) {
        when(journeyRepository.findByStatus(JourneyStatus.ACTIVE)).thenReturn(List.of(journeys));
        for (Journey journey : journeys) {
            lenient().when(journeyRepository.findById(journey.getId())).thenReturn(Optional.of(journey));
        }
    }

    @Test
    @DisplayName("Delay resumes on the first sweep after it elapses, not before")
    void delay_resumesOnlyAfterElapsing() {
        Journey journey = delayedJourney();
        activeJourneys(journey);
        when(triggerResolver.resolve(eq(journey), any())).thenReturn(TriggerResolution.of(List.of(
                new EnrollmentCandidate("cust-1", "+15550000001"),
                new EnrollmentCandidate("cust-2", "+15550000002"))));

        SweepSummary first = engine.runSweep();
        assertEquals(2, first.getEnrollmentsCreated());
        assertEquals(2, store.findWaitingDue(START.plus(Duration.ofHours(2))).size());

        clock.advance(Duration.ofMinutes(30));
        SweepSummary early = engine.runSweep();
        assertEquals(0, early.getEnrollmentsResumed());
        assertEquals(2, early.getSkipped());

        clock.advance(Duration.ofMinutes(31));
        SweepSummary due = engine.runSweep();
        assertEquals(2, due.getEnrollmentsResumed());
        assertTrue(store.findByJourney(journey.getId()).stream()
                .allMatch(e -> e.getStatus() == EnrollmentStatus.COMPLETED));
    }

    @Test
    @DisplayName("A failing journey is reported and the others still run")
    void failingJourney_isolated() {
        Journey broken = delayedJourney();
        Journey healthy = delayedJourney();
        activeJourneys(broken, healthy);
        when(triggerResolver.resolve(eq(broken), any())).thenThrow(new IllegalStateException("segment store down"));
        when(triggerResolver.resolve(eq(healthy), any()))
                .thenReturn(TriggerResolution.of(List.of(new EnrollmentCandidate("cust-1", "+15550000001"))));

        SweepSummary summary = engine.runSweep();

        assertEquals(1, summary.getEnrollmentsCreated());
        assertEquals(1, summary.getJourneysProcessed());
        assertEquals(1, summary.getErrors().size());
        assertEquals(String.valueOf(broken.getId()), summary.getErrors().get(0).getContext().get("journeyId"));
    }

    @Test
    @DisplayName("Journey with sends is aborted when the gateway is not configured")
    void unconfiguredGateway_abortsJourney() {
        Journey journey = journey(List.of(trigger("t"), send("s", "welcome", null), goal("g")),
                List.of(edge("t", "s"), edge("s", "g")));
        when(journeyRepository.findByStatus(JourneyStatus.ACTIVE)).thenReturn(List.of(journey));
        when(messagingGateway.isConfigured()).thenReturn(false);
        JourneyEnrollment pending = store.seed(JourneyEnrollment.start(journey.getId(), "cust-1", "+15550000001", "s", START));

        SweepSummary summary = engine.runSweep();

        assertEquals("Messaging gateway is not configured", summary.getErrors().get(0).getMessage());
        assertEquals(1, summary.getSkipped());
        assertEquals(EnrollmentStatus.ACTIVE, store.get(pending.getId()).getStatus());
        verify(messagingGateway, never()).send(anyString(), any());
        verifyNoInteractions(triggerResolver);
    }

    @Test
    @DisplayName("Elapsed engagement wait is routed to its timeout path by the sweep")
    void engagementTimeout_routedBySweep() {
        Journey journey = journey(
                List.of(manualTrigger(), send("s", "welcome", onRead(ExitAction.waitFor(30, "nudge_path"))),
                        goal("nudge", "nudge_path")),
                List.of(edge("t", "s")));
        activeJourneys(journey);
        when(messagingGateway.isConfigured()).thenReturn(true);
        JourneyEnrollment waiting = JourneyEnrollment.start(journey.getId(), "cust-1", "+15550000001", "s",
                START.minus(Duration.ofHours(1)));
        waiting.park(WaitingForEvent.engagementWait(START.minus(Duration.ofMinutes(1))), START.minus(Duration.ofMinutes(31)));
        waiting.setTimeoutPath("nudge_path");
        store.seed(waiting);

        SweepSummary summary = engine.runSweep();

        assertEquals(1, summary.getEnrollmentsResumed());
        JourneyEnrollment done = store.get(waiting.getId());
        assertEquals(EnrollmentStatus.COMPLETED, done.getStatus());
        assertEquals("nudge", done.getCurrentNodeId());
        verifyNoInteractions(triggerResolver);
    }

    @Test
    @DisplayName("Enrollment being walked by another worker is skipped without sending")
    void enrollmentInFlight_skipped() {
        Journey journey = journey(List.of(manualTrigger(), send("s", "welcome", null), goal("g")),
                List.of(edge("t", "s"), edge("s", "g")));
        activeJourneys(journey);
        when(messagingGateway.isConfigured()).thenReturn(true);
        JourneyEnrollment inFlight = store.seed(
                JourneyEnrollment.start(journey.getId(), "cust-1", "+15550000001", "t", START));
        when(walkLeases.acquire(eq(LeaseService.walkKey(inFlight.getId())), any(Duration.class)))
                .thenReturn(Optional.empty());

        SweepSummary summary = engine.runSweep();

        assertEquals(0, summary.getEnrollmentsAdvanced());
        assertEquals(1, summary.getSkipped());
        verify(messagingGateway, never()).send(anyString(), any());
        assertEquals(EnrollmentStatus.ACTIVE, store.get(inFlight.getId()).getStatus());
    }

    @Test
    @DisplayName("Enrollments of paused journeys are left alone")
    void pausedJourney_enrollmentsUntouched() {
        Journey paused = delayedJourney();
        paused.setStatus(JourneyStatus.PAUSED);
        when(journeyRepository.findByStatus(JourneyStatus.ACTIVE)).thenReturn(List.of());
        when(journeyRepository.findById(paused.getId())).thenReturn(Optional.of(paused));
        JourneyEnrollment enrollment = store.seed(JourneyEnrollment.start(paused.getId(), "cust-1", null, "t", START));

        SweepSummary summary = engine.runSweep();

        assertEquals(1, summary.getSkipped());
        assertEquals(EnrollmentStatus.ACTIVE, store.get(enrollment.getId()).getStatus());
    }

    @Test
    @DisplayName("Test-mode journeys sit out when the sweep excludes them")
    void testModeJourney_excluded() {
        Journey journey = delayedJourney();
        journey.setSettings(JourneySettings.builder().testMode(true).build());
        when(journeyRepository.findByStatus(JourneyStatus.ACTIVE)).thenReturn(List.of(journey));
        properties.getSweep().setIncludeTestJourneys(false);

        SweepSummary summary = engine.runSweep();

        assertEquals(0, summary.getJourneysProcessed());
        verifyNoInteractions(triggerResolver);
    }

    @Nested
    @DisplayName("Single flight")
    class SingleFlight {

        @Test
        @DisplayName("Sweep is declined when another instance holds the lock")
        void lockHeldElsewhere_declined() {
            when(leaseService.acquire(eq(LeaseService.SWEEP_LOCK_KEY), any(Duration.class))).thenReturn(Optional.empty());

            SweepSummary summary = engine.runSweep();

            assertTrue(summary.isDeclined());
            verifyNoInteractions(journeyRepository, triggerResolver);
        }

        @Test
        @DisplayName("Sweep started while one runs on this instance is declined")
        void overlappingSweep_declined() {
            Journey journey = delayedJourney();
            activeJourneys(journey);
            AtomicReference<SweepSummary> nested = new AtomicReference<>();
            when(triggerResolver.resolve(eq(journey), any())).thenAnswer(invocation -> {
                assertTrue(engine.isRunning());
                nested.set(engine.runSweep());
                return TriggerResolution.empty();
            });

            SweepSummary outer = engine.runSweep();

            assertFalse(outer.isDeclined());
            assertTrue(nested.get().isDeclined());
            assertFalse(engine.isRunning());
            verify(leaseService).release(LeaseService.SWEEP_LOCK_KEY, "token");
        }

        @Test
        @DisplayName("Cancelled sweep stops before the next candidate")
        void cancel_stopsAtBoundary() {
            Journey journey = delayedJourney();
            activeJourneys(journey);
            when(triggerResolver.resolve(eq(journey), any())).thenAnswer(invocation -> {
                engine.cancel();
                return TriggerResolution.of(List.of(new EnrollmentCandidate("cust-1", "+15550000001")));
            });

            SweepSummary summary = engine.runSweep();

            assertTrue(summary.isCancelled());
            assertEquals(0, summary.getEnrollmentsCreated());
            assertEquals(0, store.size());
        }
    }

    @Nested
    @DisplayName("Simulation")
    class Simulation {

        private Journey sendJourney() {
            Journey journey = journey(List.of(trigger("t"), send("s", "welcome", null), goal("g")),
                    List.of(edge("t", "s"), edge("s", "g")));
            when(journeyRepository.findById(journey.getId())).thenReturn(Optional.of(journey));
            return journey;
        }

        @Test
        @DisplayName("Simulation walks candidates without sending or persisting")
        void simulate_dryRun() {
            Journey journey = sendJourney();
            when(customerProfileRepository.findById("cust-1"))
                    .thenReturn(Optional.of(CustomerProfile.builder().id("cust-1").phone("+15550000001").build()));
            when(customerProfileRepository.findFirstByPhone("+15559990000")).thenReturn(Optional.empty());

            SimulationResult result = engine.simulate(journey.getId(), List.of("cust-1"), List.of("+15559990000"));

            assertEquals(2, result.getCustomers().size());
            SimulationResult.SimulatedCustomer known = result.getCustomers().get(0);
            assertTrue(known.isEligible());
            assertEquals(List.of("t", "s"), known.getPath());
            assertEquals(WaitType.MESSAGE_CALLBACK, known.getWaitingFor());
            assertEquals("test_+15559990000", result.getCustomers().get(1).getCustomerId());
            assertEquals(0, store.size());
            verify(messagingGateway, never()).send(anyString(), any());
        }

        @Test
        @DisplayName("Simulating a draft journey reports why nobody would enter")
        void simulate_draftJourney() {
            Journey journey = sendJourney();
            journey.setStatus(JourneyStatus.DRAFT);
            when(customerProfileRepository.findById("cust-1")).thenReturn(Optional.empty());

            SimulationResult result = engine.simulate(journey.getId(), List.of("cust-1"), null);

            assertFalse(result.getCustomers().get(0).isEligible());
            assertEquals(SkipReason.JOURNEY_NOT_ACTIVE, result.getCustomers().get(0).getSkipReason());
        }
    }
}
