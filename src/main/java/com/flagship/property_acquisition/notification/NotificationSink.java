package com.flagship.property_acquisition.notification;

/**
 * Fire-and-forget side channel for acquisition events.
 *
 * Implementations must never throw: a lost notification is acceptable, a rolled
 * back acquisition step because of one is not.
 */
public interface NotificationSink {

    void notify(AcquisitionEvent event);
}
