package com.growfolio.dataclient.repository;

import com.growfolio.common.dto.Requests.PreferencesRequest;
import com.growfolio.common.dto.Requests.ProfileRequest;
import com.growfolio.common.model.User;
import com.growfolio.common.model.UserSettings;
import com.growfolio.dataclient.remote.UserRemoteDataSource;
import com.growfolio.dataclient.support.SyncFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachedUserRepositoryTest {

    @Mock
    private UserRemoteDataSource remote;

    private SyncFixture fixture;
    private CachedUserRepository repository;

    @BeforeEach
    void setUp() {
        fixture = new SyncFixture();
        repository = new CachedUserRepository(remote, fixture.stores(), fixture.rules());
    }

    @Test
    @DisplayName("Current user is cached for five minutes")
    void userWindow() {
        when(remote.getCurrentUser()).thenReturn(User.builder().id("u1").build());

        repository.fetchCurrentUser();
        fixture.advance(Duration.ofMinutes(5));
        repository.fetchCurrentUser();
        fixture.advance(Duration.ofSeconds(1));
        repository.fetchCurrentUser();

        verify(remote, times(2)).getCurrentUser();
    }

    @Test
    @DisplayName("Profile update drops the cached user")
    void profileUpdateDropsUser() {
        when(remote.getCurrentUser()).thenReturn(
                User.builder().id("u1").displayName("Old").build(),
                User.builder().id("u1").displayName("New").build());
        when(remote.updateProfile(new ProfileRequest("New"))).thenReturn(User.builder().id("u1").displayName("New").build());
        repository.fetchCurrentUser();

        repository.updateProfile("New");

        assertThat(repository.fetchCurrentUser().displayName()).isEqualTo("New");
    }

    @Test
    @DisplayName("Preferences are always read from the API")
    void preferencesNotCached() {
        when(remote.getPreferences()).thenReturn(UserSettings.builder().preferredCurrency("GBP").build());

        repository.fetchPreferences();
        repository.fetchPreferences();

        verify(remote, times(2)).getPreferences();
    }

    @Test
    @DisplayName("Preference update drops the cached user")
    void preferencesDropUser() {
        when(remote.getCurrentUser()).thenReturn(User.builder().id("u1").build());
        when(remote.updatePreferences(any())).thenReturn(UserSettings.builder().build());
        repository.fetchCurrentUser();

        repository.updatePreferences(PreferencesRequest.builder().theme("dark").build());
        repository.fetchCurrentUser();

        verify(remote, times(2)).getCurrentUser();
    }
}
