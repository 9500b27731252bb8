package com.growfolio.common.model;

/*
 * 09/18/2026 - 9:33 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.FamilyMemberRole;
import com.growfolio.common.enums.InviteStatus;
import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record FamilyInvite(
        String id,
        String familyId,
        String familyName,
        String inviterId,
        String inviterName,
        String inviteeEmail,
        String inviteeUserId,
        FamilyMemberRole role,
        InviteStatus status,
        String inviteCode,
        String message,
        Instant createdAt,
        Instant expiresAt,
        Instant respondedAt) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    public boolean canBeAccepted(Instant now) {
        return status == InviteStatus.PENDING && !isExpired(now);
    }
}
