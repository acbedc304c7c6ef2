package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.model.Alert;
import com.wildsentinel.core.model.AlertRule;
import com.wildsentinel.core.model.ChannelType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Holds non-urgent notifications that arrived during a user's quiet hours.
 * Nothing is dropped; entries are released once the window has ended.
 *
 * @since 1.0.0
 */
public class QuietHoursQueue {

    /**
     * One deferred user/channel delivery.
     */
    public record Deferred(Alert alert, AlertRule rule, ChannelType channel, Instant queuedAt) {
    }

    private final List<Deferred> deferred = new ArrayList<>();

    public synchronized void defer(Alert alert, AlertRule rule, ChannelType channel, Instant now) {
        deferred.add(new Deferred(alert, rule, channel, now));
    }

    /**
     * Remove and return entries whose rule is no longer in quiet hours.
     */
    public synchronized List<Deferred> releaseDue(Instant now) {
        List<Deferred> released = new ArrayList<>();
        Iterator<Deferred> it = deferred.iterator();
        while (it.hasNext()) {
            Deferred d = it.next();
            if (!d.rule().isInQuietHours(now)) {
                released.add(d);
                it.remove();
            }
        }
        return released;
    }

    public synchronized int size() {
        return deferred.size();
    }
}
