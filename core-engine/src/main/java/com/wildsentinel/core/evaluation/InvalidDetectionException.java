package com.wildsentinel.core.evaluation;

import java.util.List;

/**
 * A detection event failed ingress validation and never entered scoring.
 *
 * @since 1.0.0
 */
public class InvalidDetectionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public InvalidDetectionException(List<String> problems) {
        super("Invalid detection: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * @return every problem found, in field order
     */
    public List<String> getProblems() {
        return problems;
    }
}
