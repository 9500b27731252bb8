package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 9:41 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.FamilyRequest;
import com.growfolio.common.dto.Requests.InviteRequest;
import com.growfolio.common.dto.Requests.MemberRoleRequest;
import com.growfolio.common.model.Family;
import com.growfolio.common.model.FamilyInvite;
import com.growfolio.common.model.FamilyMember;
import com.growfolio.common.model.MemberPrivacySettings;
import com.growfolio.common.model.ReceivedInvite;

import java.util.List;

/**
 * Family sharing on the Growfolio API. {@link #getFamily()} answers 404 when the user has no family.
 */
public interface FamilyRemoteDataSource {

    Family getFamily();

    Family createFamily(FamilyRequest request);

    Family updateFamily(String familyId, FamilyRequest request);

    void deleteFamily(String familyId);

    void leaveFamily();

    // ==================== Invites ====================

    FamilyInvite inviteMember(InviteRequest request);

    List<FamilyInvite> listPendingInvites();

    List<ReceivedInvite> listReceivedInvites();

    FamilyInvite resendInvite(String inviteId);

    void cancelInvite(String inviteId);

    Family acceptInvite(String inviteId);

    void declineInvite(String inviteId);

    // ==================== Members ====================

    FamilyMember updateMemberRole(String memberId, MemberRoleRequest request);

    FamilyMember updateMemberPrivacy(String memberId, MemberPrivacySettings settings);

    void removeMember(String memberId);
}
