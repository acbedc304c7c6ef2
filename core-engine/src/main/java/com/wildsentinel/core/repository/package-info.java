/**
 * Persistence boundaries for alerts, feedback and rules, with in-memory
 * implementations.
 */
package com.wildsentinel.core.repository;
