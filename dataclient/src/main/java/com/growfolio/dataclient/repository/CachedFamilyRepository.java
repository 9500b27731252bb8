package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:02 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.FamilyRequest;
import com.growfolio.common.dto.Requests.InviteRequest;
import com.growfolio.common.dto.Requests.MemberRoleRequest;
import com.growfolio.common.enums.FamilyMemberRole;
import com.growfolio.common.exception.ApiExceptions.NotFoundException;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.Family;
import com.growfolio.common.model.FamilyInvite;
import com.growfolio.common.model.FamilyMember;
import com.growfolio.common.model.MemberPrivacySettings;
import com.growfolio.common.model.ReceivedInvite;
import com.growfolio.dataclient.remote.FamilyRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.growfolio.dataclient.repository.CacheTargets.FAMILY;
import static com.growfolio.dataclient.repository.CacheTargets.FAMILY_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.PENDING_INVITES;
import static com.growfolio.dataclient.repository.CacheTargets.PENDING_INVITES_KEY;
import static com.growfolio.dataclient.repository.CacheTargets.RECEIVED_INVITES;
import static com.growfolio.dataclient.repository.CacheTargets.RECEIVED_INVITES_KEY;

@Slf4j
public class CachedFamilyRepository implements FamilyRepository {

    private static final String DOMAIN = "family";

    private final FamilyRemoteDataSource remote;
    private final InvalidationRules rules;

    private final CachedResource<Optional<Family>> family;
    private final CachedResource<List<FamilyInvite>> pendingInvites;
    private final CachedResource<List<ReceivedInvite>> receivedInvites;

    public CachedFamilyRepository(FamilyRemoteDataSource remote, CacheStoreFactory stores, InvalidationRules rules) {
        this.remote = remote;
        this.rules = rules;
        this.family = stores.newResource(Freshness.FAMILY);
        this.pendingInvites = stores.newResource(Freshness.PENDING_INVITES);
        this.receivedInvites = stores.newResource(Freshness.RECEIVED_INVITES);
        rules.register(FAMILY, family);
        rules.register(PENDING_INVITES, pendingInvites);
        rules.register(RECEIVED_INVITES, receivedInvites);
    }

    @Override
    public Optional<Family> getFamily() {
        return family.fetch(FAMILY_KEY, this::loadFamily);
    }

    @Override
    public Family createFamily(FamilyRequest request) {
        return mutate(DataMutation.CREATE_FAMILY, null, () -> remote.createFamily(request),
                (created, context) -> context.with(InvalidationContext.ID, created.id())
                        .merge(FAMILY, r -> r.put(FAMILY_KEY, Optional.of(created))));
    }

    @Override
    public Family updateFamily(String familyId, FamilyRequest request) {
        return mutate(DataMutation.UPDATE_FAMILY, familyId, () -> remote.updateFamily(familyId, request),
                (updated, context) -> context.merge(FAMILY, r -> r.put(FAMILY_KEY, Optional.of(updated))));
    }

    @Override
    public void deleteFamily(String familyId) {
        run(DataMutation.DELETE_FAMILY, familyId, () -> remote.deleteFamily(familyId));
    }

    @Override
    public void leaveFamily() {
        run(DataMutation.LEAVE_FAMILY, null, remote::leaveFamily);
    }

    // ==================== Invites ====================

    @Override
    public FamilyInvite inviteMember(InviteRequest request) {
        return mutate(DataMutation.INVITE_MEMBER, null, () -> remote.inviteMember(request), NO_MERGE);
    }

    @Override
    public List<FamilyInvite> pendingInvites() {
        return pendingInvites.fetch(PENDING_INVITES_KEY, remote::listPendingInvites);
    }

    @Override
    public List<ReceivedInvite> receivedInvites() {
        return receivedInvites.fetch(RECEIVED_INVITES_KEY, remote::listReceivedInvites);
    }

    @Override
    public FamilyInvite resendInvite(String inviteId) {
        return mutate(DataMutation.RESEND_INVITE, inviteId, () -> remote.resendInvite(inviteId), NO_MERGE);
    }

    @Override
    public void cancelInvite(String inviteId) {
        run(DataMutation.CANCEL_INVITE, inviteId, () -> remote.cancelInvite(inviteId));
    }

    @Override
    public Family acceptInvite(String inviteId) {
        return mutate(DataMutation.ACCEPT_INVITE, inviteId, () -> remote.acceptInvite(inviteId), NO_MERGE);
    }

    @Override
    public void declineInvite(String inviteId) {
        run(DataMutation.DECLINE_INVITE, inviteId, () -> remote.declineInvite(inviteId));
    }

    // ==================== Members ====================

    @Override
    public FamilyMember updateMemberRole(String memberId, FamilyMemberRole role) {
        return mutate(DataMutation.UPDATE_MEMBER_ROLE, memberId,
                () -> remote.updateMemberRole(memberId, new MemberRoleRequest(role)), NO_MERGE);
    }

    @Override
    public FamilyMember updateMemberPrivacy(String memberId, MemberPrivacySettings settings) {
        return mutate(DataMutation.UPDATE_MEMBER_PRIVACY, memberId,
                () -> remote.updateMemberPrivacy(memberId, settings), NO_MERGE);
    }

    @Override
    public void removeMember(String memberId) {
        run(DataMutation.REMOVE_MEMBER, memberId, () -> remote.removeMember(memberId));
    }

    @Override
    public List<FamilyMember> cachedMembers() {
        return family.current(FAMILY_KEY).flatMap(cached -> cached).map(Family::members).orElse(List.of());
    }

    @Override
    public void invalidateCache() {
        family.invalidateAll();
        pendingInvites.invalidateAll();
        receivedInvites.invalidateAll();
    }

    // ==================== Internals ====================

    /**
     * Adds the mutation's result to the invalidation context, e.g. as a merge.
     */
    private interface ContextContribution<T> {
        void contribute(T result, InvalidationContext.Builder context);
    }

    private static final ContextContribution<Object> NO_MERGE = (result, context) -> { };

    private Optional<Family> loadFamily() {
        try {
            return Optional.of(remote.getFamily());
        } catch (NotFoundException e) {
            log.debug("User has no family");
            return Optional.empty();
        }
    }

    private <T> T mutate(DataMutation kind, String resourceId, Supplier<T> call,
                         ContextContribution<? super T> contribution) {
        return LogContext.forOperation(DOMAIN, kind.name()).and(LogContext.RESOURCE_ID, resourceId).supply(() -> {
            T result = call.get();
            InvalidationContext.Builder context = InvalidationContext.builder().with(InvalidationContext.ID, resourceId);
            contribution.contribute(result, context);
            rules.apply(kind, context.build());
            log.info("{} succeeded", kind);
            return result;
        });
    }

    private void run(DataMutation kind, String resourceId, Runnable call) {
        mutate(kind, resourceId, () -> {
            call.run();
            return null;
        }, NO_MERGE);
    }
}
