package com.growfolio.common.model;

/*
 * 09/18/2026 - 11:01 AM
 * @author Growfolio Engineering
 */

/**
 * Invite addressed to the current user, with a preview of the inviting family.
 */
public record ReceivedInvite(
        FamilyInvite invite,
        int familyMemberCount,
        String familyOwnerName,
        String familyDescription) {

    public String id() {
        return invite != null ? invite.id() : null;
    }
}
