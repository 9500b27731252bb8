package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 3:01 PM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.PreferencesRequest;
import com.growfolio.common.model.User;
import com.growfolio.common.model.UserSettings;

public interface UserRepository {

    User fetchCurrentUser();

    User updateProfile(String displayName);

    /** Always read from the API. */
    UserSettings fetchPreferences();

    UserSettings updatePreferences(PreferencesRequest request);

    void deleteAccount();

    void invalidateCache();
}
