package com.journeytide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Storefront checkout. OPEN checkouts that stopped changing feed the
 * abandoned-cart trigger.
 */
@Entity
@Table(name = "checkouts", indexes = {
    @Index(name = "idx_checkouts_status_updated", columnList = "status, updated_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Checkout {

    @Id
    private String id;

    @Column(name = "store_id")
    private String storeId;

    @Column(name = "customer_id")
    private String customerId;

    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private CheckoutStatus status = CheckoutStatus.OPEN;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
