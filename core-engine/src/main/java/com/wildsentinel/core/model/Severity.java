package com.wildsentinel.core.model;

/**
 * Alert severity tiers, lowest first.
 *
 * @since 1.0.0
 */
public enum Severity {

    INFO(10),
    WARNING(100),
    CRITICAL(500),
    EMERGENCY(1000);

    private final int basePriority;

    Severity(int basePriority) {
        this.basePriority = basePriority;
    }

    /**
     * @return the priority of an alert of this severity at full confidence
     */
    public int getBasePriority() {
        return basePriority;
    }

    /**
     * @return {@code true} for CRITICAL and EMERGENCY
     */
    public boolean isUrgent() {
        return this.compareTo(CRITICAL) >= 0;
    }
}
