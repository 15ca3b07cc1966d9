package com.journeytide.model.graph;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Waits either for a relative duration or until an absolute instant.
 */
@Getter @Setter @NoArgsConstructor @SuperBuilder
public class DelayNode extends JourneyNode {

    private Long duration;

    private DelayUnit unit;

    private Instant waitUntil;

    @Override
    public NodeType getType() {
        return NodeType.DELAY;
    }

    /**
     * @return the resume instant, or null when the node has nothing to wait for
     */
    public Instant resumeAt(Instant now) {
        if (waitUntil != null) {
            return waitUntil;
        }
        if (duration == null || duration <= 0 || unit == null) {
            return null;
        }
        return now.plus(unit.toDuration(duration));
    }
}
