package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 2:08 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.FamilyRequest;
import com.growfolio.common.dto.Requests.InviteRequest;
import com.growfolio.common.enums.FamilyMemberRole;
import com.growfolio.common.model.Family;
import com.growfolio.common.model.FamilyInvite;
import com.growfolio.common.model.FamilyMember;
import com.growfolio.common.model.MemberPrivacySettings;
import com.growfolio.common.model.ReceivedInvite;

import java.util.List;
import java.util.Optional;

/**
 * The current user's family, its members and invites.
 * <p>
 * Family mutations clear the cached family. The pending and received invite lists are cached separately
 * and only their own mutations clear them.
 */
public interface FamilyRepository {

    /**
     * Empty when the user is not in a family; that answer is cached like any other.
     */
    Optional<Family> getFamily();

    Family createFamily(FamilyRequest request);

    Family updateFamily(String familyId, FamilyRequest request);

    void deleteFamily(String familyId);

    void leaveFamily();

    // ==================== Invites ====================

    FamilyInvite inviteMember(InviteRequest request);

    List<FamilyInvite> pendingInvites();

    List<ReceivedInvite> receivedInvites();

    FamilyInvite resendInvite(String inviteId);

    void cancelInvite(String inviteId);

    Family acceptInvite(String inviteId);

    void declineInvite(String inviteId);

    // ==================== Members ====================

    FamilyMember updateMemberRole(String memberId, FamilyMemberRole role);

    FamilyMember updateMemberPrivacy(String memberId, MemberPrivacySettings settings);

    void removeMember(String memberId);

    /**
     * Members of the cached family; empty when nothing is cached.
     */
    List<FamilyMember> cachedMembers();

    void invalidateCache();
}
