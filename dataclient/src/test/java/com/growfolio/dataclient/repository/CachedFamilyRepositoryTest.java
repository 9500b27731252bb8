package com.growfolio.dataclient.repository;

import com.growfolio.common.dto.Requests.FamilyRequest;
import com.growfolio.common.exception.ApiExceptions.NotFoundException;
import com.growfolio.common.exception.ApiExceptions.ServerErrorException;
import com.growfolio.common.model.Family;
import com.growfolio.common.model.User;
import com.growfolio.dataclient.remote.FamilyRemoteDataSource;
import com.growfolio.dataclient.remote.UserRemoteDataSource;
import com.growfolio.dataclient.support.SyncFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CachedFamilyRepositoryTest {

    @Mock
    private FamilyRemoteDataSource remote;

    @Mock
    private UserRemoteDataSource userRemote;

    private CachedFamilyRepository families;
    private CachedUserRepository users;

    @BeforeEach
    void setUp() {
        SyncFixture fixture = new SyncFixture();
        families = new CachedFamilyRepository(remote, fixture.stores(), fixture.rules());
        users = new CachedUserRepository(userRemote, fixture.stores(), fixture.rules());
    }

    @Test
    @DisplayName("No family (404) is cached as an empty value")
    void notFoundIsEmpty() {
        when(remote.getFamily()).thenThrow(new NotFoundException("family", "/family"));

        assertThat(families.getFamily()).isEmpty();
        assertThat(families.getFamily()).isEmpty();
        verify(remote, times(1)).getFamily();
    }

    @Test
    @DisplayName("Other failures propagate")
    void otherFailuresPropagate() {
        when(remote.getFamily()).thenThrow(new ServerErrorException(500, null));

        assertThatThrownBy(() -> families.getFamily()).isInstanceOf(ServerErrorException.class);
    }

    @Test
    @DisplayName("Created family replaces the empty value and the user is reloaded")
    void createReplacesEmpty() {
        Family created = Family.builder().id("f1").name("Smiths").maxMembers(5).build();
        when(remote.getFamily()).thenThrow(new NotFoundException("family", "/family"));
        when(remote.createFamily(any())).thenReturn(created);
        when(userRemote.getCurrentUser()).thenReturn(
                User.builder().id("u1").build(),
                User.builder().id("u1").familyId("f1").build());
        families.getFamily();
        users.fetchCurrentUser();

        families.createFamily(new FamilyRequest("Smiths", null));

        assertThat(families.getFamily()).contains(created);
        assertThat(users.fetchCurrentUser().familyId()).isEqualTo("f1");
        verify(remote, times(1)).getFamily();
    }

    @Test
    @DisplayName("Leaving drops the family and the user")
    void leaveDropsFamily() {
        Family family = Family.builder().id("f1").name("Smiths").members(List.of()).maxMembers(5).build();
        when(remote.getFamily()).thenReturn(family);
        families.getFamily();

        families.leaveFamily();
        families.getFamily();

        verify(remote, times(2)).getFamily();
    }
}
