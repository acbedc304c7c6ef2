package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.model.DeliveryReceipt;

import java.util.List;

/**
 * Receipts produced by one dispatch round of an alert.
 *
 * @param alertId     alert that was dispatched
 * @param rateLimited whether the camera's bucket was empty and nothing was
 *                    sent
 * @param receipts    one receipt per user/channel pair
 * @since 1.0.0
 */
public record DispatchReport(String alertId, boolean rateLimited, List<DeliveryReceipt> receipts) {

    public DispatchReport {
        receipts = List.copyOf(receipts);
    }

    /**
     * @return receipts with the given status
     */
    public long count(DeliveryReceipt.Status status) {
        return receipts.stream().filter(r -> r.getStatus() == status).count();
    }
}
