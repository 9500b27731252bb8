package com.growfolio.common.model;

/*
 * 09/18/2026 - 12:11 PM
 * @author Growfolio Engineering
 */

import lombok.Builder;

@Builder(toBuilder = true)
public record UserSettings(
        String preferredCurrency,
        boolean notificationsEnabled,
        boolean biometricEnabled,
        String timezoneIdentifier,
        String theme,
        boolean hapticFeedbackEnabled,
        boolean showBalances) {
}
