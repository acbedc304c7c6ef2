package com.wildsentinel.core.model;

/**
 * Notification delivery channels.
 *
 * @since 1.0.0
 */
public enum ChannelType {
    EMAIL,
    WEBHOOK,
    CHAT
}
