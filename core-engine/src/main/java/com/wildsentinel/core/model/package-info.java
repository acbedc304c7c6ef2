/**
 * Domain model classes for Wildlife Sentinel.
 *
 * <ul>
 * <li>{@link com.wildsentinel.core.model.DetectionEvent}: raw sighting from
 * the upstream classifier</li>
 * <li>{@link com.wildsentinel.core.model.ScoredDetection}: detection plus
 * corroboration and anomaly scores</li>
 * <li>{@link com.wildsentinel.core.model.Alert}: classified alert and its
 * lifecycle ({@link com.wildsentinel.core.model.AlertState})</li>
 * <li>{@link com.wildsentinel.core.model.ActivityBaseline}: rolling activity
 * statistics per camera, species and hour</li>
 * <li>{@link com.wildsentinel.core.model.AlertRule}: per-user notification
 * preferences</li>
 * <li>{@link com.wildsentinel.core.model.FeedbackRecord}: user verdict on an
 * alert</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.wildsentinel.core.model;
