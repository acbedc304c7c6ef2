/**
 * Read access to detection history and camera metadata, with a
 * time-limited decorator that degrades to neutral defaults.
 *
 * @since 1.0.0
 */
package com.wildsentinel.core.context;
