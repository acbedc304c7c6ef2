/**
 * Feedback-driven adaptation of scoring parameters.
 *
 * <p>
 * Parameters live in immutable, versioned
 * {@link com.wildsentinel.core.adaptation.ParameterSnapshot}s published
 * through {@link com.wildsentinel.core.adaptation.ParameterRegistry}, so an
 * evaluation never observes a half-updated parameter set.
 * </p>
 *
 * @since 1.0.0
 */
package com.wildsentinel.core.adaptation;
