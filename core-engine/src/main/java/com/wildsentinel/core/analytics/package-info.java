/**
 * Feedback-based accuracy reporting.
 */
package com.wildsentinel.core.analytics;
