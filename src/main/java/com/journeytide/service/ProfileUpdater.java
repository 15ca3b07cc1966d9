package com.journeytide.service;

import com.journeytide.model.CustomerProfile;
import com.journeytide.model.graph.ProfileUpdate;
import com.journeytide.repository.CustomerProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes journey-driven changes onto customer profiles.
 *
 *   set       → attributes[property] = value
 *   increment → attributes[property] = (attributes[property] or 0) + value
 *   append    → attributes[property] becomes a list with value added
 *
 * Unknown customers are logged and ignored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProfileUpdater {

    private final CustomerProfileRepository customerProfileRepository;

    @Transactional
    public void apply(String customerId, List<ProfileUpdate> updates) {
        if (updates == null || updates.isEmpty()) {
            return;
        }
        customerProfileRepository.findById(customerId).ifPresentOrElse(customer -> {
            Map<String, Object> attributes = customer.attributesMap();
            for (ProfileUpdate update : updates) {
                if (update.getProperty() == null || update.getOperation() == null) {
                    log.warn("Skipping incomplete profile update for customerId={}", customerId);
                    continue;
                }
                String property = update.getProperty();
                Object value = update.getValue();
                switch (update.getOperation()) {
                    case SET -> attributes.put(property, value);
                    case INCREMENT -> attributes.put(property, increment(attributes.get(property), value));
                    case APPEND -> attributes.put(property, append(attributes.get(property), value));
                }
            }
            customerProfileRepository.save(customer);
            log.info("Applied {} profile update(s) for customerId={}", updates.size(), customerId);
        }, () -> log.warn("Profile update skipped, customer not found: customerId={}", customerId));
    }

    @Transactional
    public void addTag(String customerId, String tag) {
        CustomerProfile customer = customerProfileRepository.findById(customerId).orElse(null);
        if (customer == null) {
            log.warn("Tag {} not added, customer not found: customerId={}", tag, customerId);
            return;
        }
        customer.addTag(tag);
        customerProfileRepository.save(customer);
    }

    @Transactional
    public void setProperty(String customerId, String key, Object value) {
        CustomerProfile customer = customerProfileRepository.findById(customerId).orElse(null);
        if (customer == null) {
            log.warn("Property {} not set, customer not found: customerId={}", key, customerId);
            return;
        }
        customer.attributesMap().put(key, value);
        customerProfileRepository.save(customer);
    }

    private Object increment(Object current, Object delta) {
        double step = delta instanceof Number ? ((Number) delta).doubleValue() : parseOrDefault(delta, 1);
        double base = current instanceof Number ? ((Number) current).doubleValue() : parseOrDefault(current, 0);
        double result = base + step;
        if (result == Math.rint(result) && Math.abs(result) < Long.MAX_VALUE) {
            return (long) result;
        }
        return result;
    }

    private List<Object> append(Object current, Object value) {
        List<Object> list = new ArrayList<>();
        if (current instanceof Collection) {
            list.addAll((Collection<?>) current);
        } else if (current != null) {
            list.add(current);
        }
        list.add(value);
        return list;
    }

    private double parseOrDefault(Object value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
