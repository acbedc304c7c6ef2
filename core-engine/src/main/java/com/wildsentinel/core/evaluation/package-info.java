/**
 * Per-detection orchestration: ingress validation, scoring, anomaly
 * detection, classification, correlation and corrections.
 *
 * <p>
 * Everything up to the dispatcher runs here; dispatch is a separate stage
 * so a slow channel never holds up evaluation.
 * </p>
 */
package com.wildsentinel.core.evaluation;
