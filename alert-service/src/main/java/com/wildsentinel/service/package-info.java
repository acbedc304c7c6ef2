/**
 * Runtime wiring of the wildlife alert engine: Kafka ingestion, per-camera
 * worker lanes, the REST surface and metrics.
 */
package com.wildsentinel.service;
