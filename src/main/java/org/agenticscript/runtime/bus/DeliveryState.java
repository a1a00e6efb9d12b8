package org.agenticscript.runtime.bus;

public enum DeliveryState {
    PENDING,
    DELIVERED,
    FAILED,
    TIMED_OUT
}
