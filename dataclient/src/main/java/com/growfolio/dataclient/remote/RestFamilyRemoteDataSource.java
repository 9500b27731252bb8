package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:20 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.dto.Requests.FamilyRequest;
import com.growfolio.common.dto.Requests.InviteRequest;
import com.growfolio.common.dto.Requests.MemberRoleRequest;
import com.growfolio.common.model.Family;
import com.growfolio.common.model.FamilyInvite;
import com.growfolio.common.model.FamilyMember;
import com.growfolio.common.model.MemberPrivacySettings;
import com.growfolio.common.model.ReceivedInvite;
import org.springframework.http.HttpMethod;

import java.util.List;
import java.util.Map;

public class RestFamilyRemoteDataSource implements FamilyRemoteDataSource {

    private static final TypeReference<Family> FAMILY = new TypeReference<>() {};
    private static final TypeReference<FamilyInvite> INVITE = new TypeReference<>() {};
    private static final TypeReference<List<FamilyInvite>> INVITES = new TypeReference<>() {};
    private static final TypeReference<List<ReceivedInvite>> RECEIVED_INVITES = new TypeReference<>() {};
    private static final TypeReference<FamilyMember> MEMBER = new TypeReference<>() {};

    private final ApiClient api;

    public RestFamilyRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public Family getFamily() {
        return api.get(FAMILY, "/family");
    }

    @Override
    public Family createFamily(FamilyRequest request) {
        return api.post(FAMILY, request, "/family");
    }

    @Override
    public Family updateFamily(String familyId, FamilyRequest request) {
        return api.patch(FAMILY, request, "/family/{id}", familyId);
    }

    @Override
    public void deleteFamily(String familyId) {
        api.delete("/family/{id}", familyId);
    }

    @Override
    public void leaveFamily() {
        api.send(HttpMethod.POST, Map.of(), "/family/leave");
    }

    // ==================== Invites ====================

    @Override
    public FamilyInvite inviteMember(InviteRequest request) {
        return api.post(INVITE, request, "/family/invite");
    }

    @Override
    public List<FamilyInvite> listPendingInvites() {
        return api.get(INVITES, "/family/invites");
    }

    @Override
    public List<ReceivedInvite> listReceivedInvites() {
        return api.get(RECEIVED_INVITES, "/family/invites/received");
    }

    @Override
    public FamilyInvite resendInvite(String inviteId) {
        return api.post(INVITE, Map.of(), "/family/invites/{id}/resend", inviteId);
    }

    @Override
    public void cancelInvite(String inviteId) {
        api.delete("/family/invites/{id}", inviteId);
    }

    @Override
    public Family acceptInvite(String inviteId) {
        return api.post(FAMILY, Map.of(), "/family/invites/{id}/accept", inviteId);
    }

    @Override
    public void declineInvite(String inviteId) {
        api.send(HttpMethod.POST, Map.of(), "/family/invites/{id}/decline", inviteId);
    }

    // ==================== Members ====================

    @Override
    public FamilyMember updateMemberRole(String memberId, MemberRoleRequest request) {
        return api.patch(MEMBER, request, "/family/members/{id}", memberId);
    }

    @Override
    public FamilyMember updateMemberPrivacy(String memberId, MemberPrivacySettings settings) {
        return api.patch(MEMBER, settings, "/family/members/{id}/privacy", memberId);
    }

    @Override
    public void removeMember(String memberId) {
        api.delete("/family/members/{id}", memberId);
    }
}
