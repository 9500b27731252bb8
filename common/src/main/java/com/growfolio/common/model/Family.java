package com.growfolio.common.model;

/*
 * 09/18/2026 - 9:26 AM
 * @author Growfolio Engineering
 */

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Family group the current user belongs to.
 */
@Builder(toBuilder = true)
public record Family(
        String id,
        String name,
        String familyDescription,
        String ownerId,
        List<String> adminIds,
        List<FamilyMember> members,
        int maxMembers,
        boolean allowSharedGoals,
        Instant createdAt,
        Instant updatedAt) {

    public Family {
        adminIds = adminIds != null ? List.copyOf(adminIds) : List.of();
        members = members != null ? List.copyOf(members) : List.of();
    }

    public int memberCount() {
        return members.size();
    }

    public boolean canAddMembers() {
        return memberCount() < maxMembers;
    }
}
