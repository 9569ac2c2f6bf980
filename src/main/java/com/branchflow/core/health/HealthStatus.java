package com.branchflow.core.health;

import java.util.Locale;
import java.util.Map;

/**
 * Result of one readiness check.
 *
 * @param component what was checked
 * @param status    outcome of the check
 * @param detail    one line for the operator
 * @param remedy    what to do about a non-UP status, null when UP
 * @param metadata  extra facts (paths, sink names, failure counts)
 */
public record HealthStatus(
    Component component,
    Status status,
    String detail,
    String remedy,
    Map<String, String> metadata
) {

    public enum Status { UP, DEGRADED, DOWN }

    /**
     * Things branchflow needs. Promotion cannot run without git and a working
     * tree; notifications only affect who hears about it.
     */
    public enum Component {
        GIT(true),
        REPOSITORY(true),
        NOTIFICATION(false);

        private final boolean requiredToPromote;

        Component(boolean requiredToPromote) {
            this.requiredToPromote = requiredToPromote;
        }

        public boolean requiredToPromote() {
            return requiredToPromote;
        }

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static HealthStatus up(Component component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, null, metadata);
    }

    public static HealthStatus degraded(Component component, String detail, String remedy,
                                        Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, remedy, metadata);
    }

    public static HealthStatus down(Component component, String detail, String remedy,
                                    Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, remedy, metadata);
    }

    /** True when a promotion started now would fail because of this component. */
    public boolean blocksPromotion() {
        return status == Status.DOWN && component.requiredToPromote();
    }
}
