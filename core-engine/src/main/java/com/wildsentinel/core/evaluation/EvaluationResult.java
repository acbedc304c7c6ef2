package com.wildsentinel.core.evaluation;

import com.wildsentinel.core.classification.ClassificationDecision;
import com.wildsentinel.core.correlation.CorrelationOutcome;
import com.wildsentinel.core.model.Alert;

/**
 * What happened to one detection.
 *
 * @param outcome     the branch taken
 * @param alert       the alert created or touched
 * @param decision    the classifier's decision, {@code null} for an ignored
 *                    correction
 * @param correlation correlation outcome, {@code null} unless promoted
 * @since 1.0.0
 */
public record EvaluationResult(Outcome outcome, Alert alert, ClassificationDecision decision,
        CorrelationOutcome correlation) {

    /** Branches of the evaluation. */
    public enum Outcome {
        /** Recorded as a filtered audit record. */
        FILTERED,
        /** Promoted and ready for dispatch. */
        PROMOTED,
        /** Promoted, then found to duplicate an earlier alert. */
        DUPLICATE,
        /** A correction with higher confidence replaced an alert's scores. */
        SUPERSEDED,
        /** A correction that did not improve on the existing alert. */
        CORRECTION_IGNORED
    }

    /**
     * @return whether the alert should go to the dispatcher
     */
    public boolean isDispatchable() {
        return outcome == Outcome.PROMOTED;
    }
}
