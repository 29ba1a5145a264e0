package com.example.shiftplanner.client;

public enum SyncState {
    /** Nothing scheduled and nothing on the wire. */
    IDLE,
    /** A debounce window is open. */
    PENDING,
    /** A batch has been sent and its response has not arrived. */
    IN_FLIGHT
}
