/**
 * Ensemble confidence scoring of raw detections.
 */
package com.wildsentinel.core.scoring;
