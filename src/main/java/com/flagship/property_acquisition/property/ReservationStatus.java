package com.flagship.property_acquisition.property;

/**
 * A property is either unreserved (null column) or RESERVED by exactly one client.
 */
public enum ReservationStatus {
    RESERVED
}
