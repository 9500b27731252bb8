package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:36 AM
 * @author Growfolio Engineering
 */

public record MemberPrivacySettings(
        boolean sharePortfolioValue,
        boolean shareHoldings,
        boolean sharePerformance,
        boolean shareGoals,
        boolean shareDcaSchedules) {
}
