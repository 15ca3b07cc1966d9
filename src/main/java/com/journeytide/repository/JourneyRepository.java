package com.journeytide.repository;

import com.journeytide.model.Journey;
import com.journeytide.model.JourneyStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Database access for Journey definitions.
 *
 * findByStatus(ACTIVE)
 * → SELECT * FROM journeys WHERE status = 'ACTIVE'
 */
public interface JourneyRepository extends JpaRepository<Journey, UUID> {

    // Used by the sweep: every journey that takes part in enrollment
    List<Journey> findByStatus(JourneyStatus status);

    // Used by the API: tenant-scoped listing
    List<Journey> findByStoreId(String storeId);
}
