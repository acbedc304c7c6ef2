package com.wildsentinel.core.repository;

import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertState;
import com.wildsentinel.core.model.Severity;

/**
 * Filter and page for alert listings. {@code null} criteria match anything.
 *
 * @since 1.0.0
 */
public final class AlertQuery {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private Severity severity;
    private Boolean resolved;
    private String cameraId;
    private boolean includeFiltered;
    private int limit = DEFAULT_LIMIT;
    private int offset;

    public static AlertQuery all() {
        return new AlertQuery();
    }

    public AlertQuery severity(Severity severity) {
        this.severity = severity;
        return this;
    }

    public AlertQuery resolved(Boolean resolved) {
        this.resolved = resolved;
        return this;
    }

    public AlertQuery cameraId(String cameraId) {
        this.cameraId = cameraId;
        return this;
    }

    /**
     * Also list filtered and duplicate alerts (the audit trail).
     */
    public AlertQuery includeFiltered(boolean includeFiltered) {
        this.includeFiltered = includeFiltered;
        return this;
    }

    public AlertQuery limit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be in [1, " + MAX_LIMIT + "], got: " + limit);
        }
        this.limit = limit;
        return this;
    }

    public AlertQuery offset(int offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
        this.offset = offset;
        return this;
    }

    /**
     * @return whether {@code alert} satisfies every criterion
     */
    public boolean matches(Alert alert) {
        AlertState state = alert.getState();
        if (!includeFiltered && (state == AlertState.FILTERED || state == AlertState.DUPLICATE)) {
            return false;
        }
        if (severity != null && alert.getSeverity() != severity) {
            return false;
        }
        if (resolved != null && resolved != (state == AlertState.RESOLVED)) {
            return false;
        }
        return cameraId == null || cameraId.equals(alert.getCameraId());
    }

    public int getLimit() {
        return limit;
    }

    public int getOffset() {
        return offset;
    }
}
