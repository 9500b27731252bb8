package com.growfolio.common.model;

/*
 * 09/18/2026 - 9:37 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.FamilyMemberRole;
import com.growfolio.common.enums.FamilyMemberStatus;
import lombok.Builder;

import java.time.Instant;

@Builder(toBuilder = true)
public record FamilyMember(
        String uniqueId,
        String userId,
        String name,
        String email,
        FamilyMemberRole role,
        String pictureUrl,
        Instant joinedAt,
        FamilyMemberStatus status,
        boolean sharePortfolioValue,
        boolean shareHoldings,
        boolean sharePerformance) {
}
