package com.growfolio.dataclient.remote;

/*
 * 09/24/2026 - 11:09 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.dto.Requests.PreferencesRequest;
import com.growfolio.common.dto.Requests.ProfileRequest;
import com.growfolio.common.model.User;
import com.growfolio.common.model.UserSettings;

public interface UserRemoteDataSource {

    User getCurrentUser();

    User updateProfile(ProfileRequest request);

    UserSettings getPreferences();

    UserSettings updatePreferences(PreferencesRequest request);

    void deleteAccount();
}
