/**
 * Per camera/species/hour activity baselines and the anomaly detector that
 * scores detections against them.
 *
 * <p>
 * Baselines are exponentially weighted so they follow seasonal drift over a
 * few weeks.
 * </p>
 */
package com.wildsentinel.core.anomaly;
