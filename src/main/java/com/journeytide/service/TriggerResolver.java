package com.journeytide.service;

import com.journeytide.dto.EngineIssue;
import com.journeytide.model.Checkout;
import com.journeytide.model.CheckoutStatus;
import com.journeytide.model.CustomerProfile;
import com.journeytide.model.Journey;
import com.journeytide.model.Segment;
import com.journeytide.model.graph.TriggerNode;
import com.journeytide.repository.CheckoutRepository;
import com.journeytide.repository.CustomerProfileRepository;
import com.journeytide.repository.SegmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Produces the customers a journey's trigger wants to enroll on this sweep.
 *
 *   segment_joined → every customer currently matching the segment
 *   abandoned_cart → customers with an OPEN checkout idle for trigger.hours (default 24)
 *   event_trigger, date_time → nothing; these fire from outside the sweep
 *   manual_entry   → nothing; only the manual enrollment endpoint enrolls
 *
 * Candidates are not filtered for existing enrollments here; the enrollment
 * manager applies dedup and re-entry rules.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TriggerResolver {

    static final int DEFAULT_ABANDONED_CART_HOURS = 24;

    private final SegmentRepository segmentRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final CheckoutRepository checkoutRepository;
    private final SegmentEvaluator segmentEvaluator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public TriggerResolution resolve(Journey journey, TriggerNode trigger) {
        return switch (trigger.resolveSubtype()) {
            case SEGMENT_JOINED -> resolveSegment(journey, trigger);
            case ABANDONED_CART -> resolveAbandonedCarts(journey, trigger);
            case EVENT_TRIGGER, DATE_TIME -> {
                log.debug("Trigger {} is not polled: journeyId={}", trigger.resolveSubtype(), journey.getId());
                yield TriggerResolution.empty();
            }
            case MANUAL_ENTRY -> TriggerResolution.empty();
        };
    }

    private TriggerResolution resolveSegment(Journey journey, TriggerNode trigger) {
        String segmentId = Optional.ofNullable(trigger.getTrigger())
                .map(TriggerNode.TriggerSettings::getSegmentId)
                .filter(id -> !id.isBlank())
                .orElseGet(() -> journey.effectiveSettings().getEntry() != null
                        ? journey.effectiveSettings().getEntry().getSegmentId()
                        : null);

        if (segmentId == null || segmentId.isBlank()) {
            log.debug("Segment trigger without a segment id: journeyId={}", journey.getId());
            return TriggerResolution.empty();
        }

        Optional<Segment> segment = segmentRepository.findById(segmentId);
        if (segment.isEmpty()) {
            log.warn("Trigger segment not found: journeyId={}, segmentId={}", journey.getId(), segmentId);
            return TriggerResolution.withIssue(EngineIssue.warn("Trigger segment not found",
                    Map.of("journeyId", String.valueOf(journey.getId()), "segmentId", segmentId)));
        }

        List<CustomerProfile> customers = journey.getStoreId() != null
                ? customerProfileRepository.findByStoreId(journey.getStoreId())
                : customerProfileRepository.findAll();

        List<EnrollmentCandidate> candidates = new ArrayList<>();
        for (CustomerProfile customer : customers) {
            if (segmentEvaluator.matches(customer, segment.get().getConditionGroups())) {
                candidates.add(new EnrollmentCandidate(customer.getId(), customer.getPhone()));
            }
        }
        log.info("Segment trigger resolved: journeyId={}, segmentId={}, matched={}/{}",
                journey.getId(), segmentId, candidates.size(), customers.size());
        return TriggerResolution.of(candidates);
    }

    private TriggerResolution resolveAbandonedCarts(Journey journey, TriggerNode trigger) {
        int hours = Optional.ofNullable(trigger.getTrigger())
                .map(TriggerNode.TriggerSettings::getHours)
                .filter(h -> h >= 0)
                .orElse(DEFAULT_ABANDONED_CART_HOURS);
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));

        List<Checkout> checkouts = checkoutRepository.findByStatusAndUpdatedAtLessThanEqual(CheckoutStatus.OPEN, cutoff);

        // one candidate per customer, however many carts they left behind
        Map<String, EnrollmentCandidate> byCustomer = new LinkedHashMap<>();
        for (Checkout checkout : checkouts) {
            if (journey.getStoreId() != null && checkout.getStoreId() != null
                    && !journey.getStoreId().equals(checkout.getStoreId())) {
                continue;
            }
            resolveCustomer(checkout).ifPresentOrElse(
                    candidate -> byCustomer.putIfAbsent(candidate.getCustomerId(), candidate),
                    () -> log.debug("Dropping checkout without a known customer: checkoutId={}", checkout.getId()));
        }
        log.info("Abandoned-cart trigger resolved: journeyId={}, hours={}, checkouts={}, customers={}",
                journey.getId(), hours, checkouts.size(), byCustomer.size());
        return TriggerResolution.of(new ArrayList<>(byCustomer.values()));
    }

    private Optional<EnrollmentCandidate> resolveCustomer(Checkout checkout) {
        if (checkout.getCustomerId() != null && !checkout.getCustomerId().isBlank()) {
            String phone = checkout.getPhone();
            if (phone == null) {
                phone = customerProfileRepository.findById(checkout.getCustomerId())
                        .map(CustomerProfile::getPhone)
                        .orElse(null);
            }
            return Optional.of(new EnrollmentCandidate(checkout.getCustomerId(), phone));
        }
        if (checkout.getPhone() != null && !checkout.getPhone().isBlank()) {
            return customerProfileRepository.findFirstByPhone(checkout.getPhone())
                    .map(customer -> new EnrollmentCandidate(customer.getId(), checkout.getPhone()));
        }
        return Optional.empty();
    }
}
