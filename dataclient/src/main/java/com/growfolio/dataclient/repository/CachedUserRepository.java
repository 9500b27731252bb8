package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:37 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.PreferencesRequest;
import com.growfolio.common.dto.Requests.ProfileRequest;
import com.growfolio.common.logging.LogContext;
import com.growfolio.common.model.User;
import com.growfolio.common.model.UserSettings;
import com.growfolio.dataclient.remote.UserRemoteDataSource;
import com.growfolio.synccore.cache.CacheStoreFactory;
import com.growfolio.synccore.invalidation.InvalidationContext;
import com.growfolio.synccore.invalidation.InvalidationRules;
import com.growfolio.synccore.resource.CachedResource;
import lombok.extern.slf4j.Slf4j;

import static com.growfolio.dataclient.repository.CacheTargets.USER;
import static com.growfolio.dataclient.repository.CacheTargets.USER_KEY;

@Slf4j
public class CachedUserRepository implements UserRepository {

    private static final String DOMAIN = "user";

    private final UserRemoteDataSource remote;
    private final InvalidationRules rules;
    private final CachedResource<User> user;

    public CachedUserRepository(UserRemoteDataSource remote, CacheStoreFactory stores, InvalidationRules rules) {
        this.remote = remote;
        this.rules = rules;
        this.user = stores.newResource(Freshness.USER);
        rules.register(USER, user);
    }

    @Override
    public User fetchCurrentUser() {
        return user.fetch(USER_KEY, remote::getCurrentUser);
    }

    @Override
    public User updateProfile(String displayName) {
        return LogContext.forOperation(DOMAIN, "updateProfile").supply(() -> {
            User updated = remote.updateProfile(new ProfileRequest(displayName));
            rules.apply(DataMutation.UPDATE_PROFILE, InvalidationContext.of(InvalidationContext.ID, updated.id()));
            log.info("Updated profile of user {}", updated.id());
            return updated;
        });
    }

    @Override
    public UserSettings fetchPreferences() {
        return remote.getPreferences();
    }

    @Override
    public UserSettings updatePreferences(PreferencesRequest request) {
        return LogContext.forOperation(DOMAIN, "updatePreferences").supply(() -> {
            UserSettings settings = remote.updatePreferences(request);
            rules.apply(DataMutation.UPDATE_PREFERENCES, InvalidationContext.empty());
            log.info("Updated preferences");
            return settings;
        });
    }

    @Override
    public void deleteAccount() {
        LogContext.forOperation(DOMAIN, "deleteAccount").run(() -> {
            remote.deleteAccount();
            rules.apply(DataMutation.DELETE_ACCOUNT, InvalidationContext.empty());
            log.info("Deleted account");
        });
    }

    @Override
    public void invalidateCache() {
        user.invalidateAll();
    }
}
