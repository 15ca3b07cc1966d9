package com.journeytide.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * What to do with a parked enrollment once its exit path fires.
 *
 *   branch   → jump to branchId (node id or node branch alias)
 *   continue → follow the node's first outgoing edge
 *   wait     → keep waiting waitDuration minutes, then route to timeoutPath
 *   exit     → end the enrollment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class ExitAction {

    private ExitActionType type;

    private String branchId;

    /** Minutes. */
    private Integer waitDuration;

    private String timeoutPath;

    public static ExitAction branch(String branchId) {
        return new ExitAction(ExitActionType.BRANCH, branchId, null, null);
    }

    public static ExitAction proceed() {
        return new ExitAction(ExitActionType.CONTINUE, null, null, null);
    }

    public static ExitAction waitFor(int minutes, String timeoutPath) {
        return new ExitAction(ExitActionType.WAIT, null, minutes, timeoutPath);
    }

    public static ExitAction exit() {
        return new ExitAction(ExitActionType.EXIT, null, null, null);
    }
}
