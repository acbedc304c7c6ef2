package com.wildsentinel.core.correlation;

import java.util.List;

/**
 * What the correlation engine decided for one promoted alert.
 *
 * @param duplicateOf      id of the earlier alert this one duplicates, or
 *                         {@code null}
 * @param correlationGroup shared group id, or {@code null} if nothing related
 *                         was in the window
 * @param relatedAlertIds  ids of the alerts grouped with this one
 * @since 1.0.0
 */
public record CorrelationOutcome(String duplicateOf, String correlationGroup, List<String> relatedAlertIds) {

    public CorrelationOutcome {
        relatedAlertIds = List.copyOf(relatedAlertIds);
    }

    static CorrelationOutcome duplicate(String originalId) {
        return new CorrelationOutcome(originalId, null, List.of());
    }

    static CorrelationOutcome distinct(String group, List<String> related) {
        return new CorrelationOutcome(null, group, related);
    }

    public boolean isDuplicate() {
        return duplicateOf != null;
    }
}
