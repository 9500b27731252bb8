package com.growfolio.common.enums;

/*
 * 09/15/2026 - 12:17 PM
 * @author Growfolio Engineering
 */

/**
 * Dimension used to group holdings when computing an allocation breakdown.
 */
public enum AllocationGrouping {
    SECTOR,
    ASSET_TYPE,
    INDUSTRY,
    HOLDING
}
