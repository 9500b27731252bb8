package com.growfolio.common.enums;

/*
 * 09/15/2026 - 12:42 PM
 * @author Growfolio Engineering
 */

/**
 * Derived status of a recurring investment schedule. Computed client side, never sent by the server.
 */
public enum DcaScheduleStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    PENDING_EXECUTION
}
