package com.journeytide.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Storefront customer as synced from the commerce platform. Properties written
 * by journeys (update_property, button profile updates) land in attributes.
 */
@Entity
@Table(name = "customer_profiles")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CustomerProfile {

    @Id
    private String id;

    @Column(name = "store_id")
    private String storeId;

    @Column(name = "first_name")
    private String firstName;

    @Column(name = "last_name")
    private String lastName;

    private String email;

    private String phone;

    /** Comma separated, as the storefront sends them. */
    @Column(columnDefinition = "TEXT")
    private String tags;

    @Column(name = "orders_count")
    private Integer ordersCount;

    @Column(name = "total_spent")
    private BigDecimal totalSpent;

    @Column(name = "accepts_marketing")
    private Boolean acceptsMarketing;

    private String country;

    private String city;

    private String province;

    private String zip;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "attributes", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public String fullName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }

    public List<String> tagList() {
        if (tags == null || tags.isBlank()) {
            return List.of();
        }
        return Arrays.stream(tags.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .toList();
    }

    public boolean hasTag(String tag) {
        return tagList().stream().anyMatch(existing -> existing.equalsIgnoreCase(tag));
    }

    public void addTag(String tag) {
        if (tag == null || tag.isBlank() || hasTag(tag)) {
            return;
        }
        tags = tags == null || tags.isBlank() ? tag.trim() : tags + ", " + tag.trim();
    }

    public Map<String, Object> attributesMap() {
        if (attributes == null) {
            attributes = new LinkedHashMap<>();
        }
        return attributes;
    }
}
