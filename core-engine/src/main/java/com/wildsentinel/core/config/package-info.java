/**
 * Engine tuning: the YAML-backed {@link com.wildsentinel.core.config.EngineConfig},
 * its loader and the data-driven species profiles.
 */
package com.wildsentinel.core.config;
