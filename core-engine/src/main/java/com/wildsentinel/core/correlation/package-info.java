/**
 * Deduplication and informational grouping of promoted alerts.
 */
package com.wildsentinel.core.correlation;
