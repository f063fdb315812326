package com.carepulse.model.enums;

/**
 * Status of a walk-in queue ticket. Tickets are issued as CHECKED_IN.
 */
public enum QueueStatus {
    CHECKED_IN,
    WAITING,
    CALLED,
    SEEN,
    FINISHED
}
