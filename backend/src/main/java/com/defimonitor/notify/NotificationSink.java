package com.defimonitor.notify;

import com.defimonitor.model.ProtocolAlert;

/**
 * Best-effort delivery of a freshly raised alert.
 * Implementations report failure through the return value and never throw.
 */
public interface NotificationSink {

    /**
     * @return true when the alert was delivered, false when the sink is disabled or delivery failed
     */
    boolean send(ProtocolAlert alert);
}
