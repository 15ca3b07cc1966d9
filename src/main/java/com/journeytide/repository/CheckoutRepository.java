package com.journeytide.repository;

import com.journeytide.model.Checkout;
import com.journeytide.model.CheckoutStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

/**
 * findByStatusAndUpdatedAtLessThanEqual(OPEN, now - 24h)
 * → open checkouts nobody touched for at least a day
 */
public interface CheckoutRepository extends JpaRepository<Checkout, String> {

    List<Checkout> findByStatusAndUpdatedAtLessThanEqual(CheckoutStatus status, Instant cutoff);
}
