package com.journeytide.model;

import com.journeytide.model.graph.ConditionGroup;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;

/**
 * A saved audience. Groups are ANDed together; each group combines its own
 * conditions with AND or OR.
 */
@Entity
@Table(name = "segments")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Segment {

    @Id
    private String id;

    @Column(name = "store_id")
    private String storeId;

    @Column(nullable = false)
    private String name;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "condition_groups", columnDefinition = "jsonb")
    @Builder.Default
    private List<ConditionGroup> conditionGroups = new ArrayList<>();
}
