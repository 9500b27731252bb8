package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 10:55 AM
 * @author Growfolio Engineering
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.growfolio.common.dto.Requests.PreferencesRequest;
import com.growfolio.common.dto.Requests.ProfileRequest;
import com.growfolio.common.model.User;
import com.growfolio.common.model.UserSettings;

public class RestUserRemoteDataSource implements UserRemoteDataSource {

    private static final TypeReference<User> USER = new TypeReference<>() {};
    private static final TypeReference<UserSettings> SETTINGS = new TypeReference<>() {};

    private final ApiClient api;

    public RestUserRemoteDataSource(ApiClient api) {
        this.api = api;
    }

    @Override
    public User getCurrentUser() {
        return api.get(USER, "/users/me");
    }

    @Override
    public User updateProfile(ProfileRequest request) {
        return api.patch(USER, request, "/users/me");
    }

    @Override
    public UserSettings getPreferences() {
        return api.get(SETTINGS, "/users/me/preferences");
    }

    @Override
    public UserSettings updatePreferences(PreferencesRequest request) {
        return api.put(SETTINGS, request, "/users/me/preferences");
    }

    @Override
    public void deleteAccount() {
        api.delete("/users/me");
    }
}
