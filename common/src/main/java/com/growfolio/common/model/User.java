package com.growfolio.common.model;

/*
 * 09/18/2026 - 12:03 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.SubscriptionTier;
import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record User(
        String id,
        String email,
        String displayName,
        String firstName,
        String lastName,
        String profilePictureUrl,
        String familyId,
        String preferredCurrency,
        boolean notificationsEnabled,
        boolean biometricEnabled,
        SubscriptionTier subscriptionTier,
        Instant subscriptionExpiresAt,
        String timezoneIdentifier,
        Instant createdAt,
        Instant updatedAt) {

    public String displayNameOrEmail() {
        return displayName != null && !displayName.isBlank() ? displayName : email;
    }
}
