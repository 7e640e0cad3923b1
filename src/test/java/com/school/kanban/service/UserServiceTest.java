package com.school.kanban.service;

import com.school.kanban.api.dto.AccountDto;
import com.school.kanban.model.AppUser;
import com.school.kanban.repo.AppUserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

  @Mock private AppUserRepository users;

  @InjectMocks
  private UserService service;

  private static AppUser user(long id, boolean superuser) {
    AppUser u = new AppUser();
    u.id = id;
    u.subject = "sub-" + id;
    u.username = "user" + id;
    u.superuser = superuser;
    return u;
  }

  // ========================================
  // LISTING
  // ========================================

  @Test
  @DisplayName("only superusers can list accounts")
  void list_requiresSuperuser() {
    assertThatThrownBy(() -> service.list(user(1, false), 0, 100))
        .isInstanceOf(ServiceExceptions.ForbiddenException.class)
        .hasMessage("Not enough permissions");
    verify(users, never()).listPage(anyInt(), anyInt());
  }

  @Test
  @DisplayName("superusers get one page of accounts")
  void list_returnsPage() {
    when(users.listPage(10, 2)).thenReturn(List.of(user(11, false), user(12, false)));

    List<AccountDto> page = service.list(user(1, true), 10, 2);

    assertThat(page).extracting(a -> a.id).containsExactly(11L, 12L);
    assertThat(page).allMatch(a -> a.active);
  }

  @Test
  @DisplayName("page size outside 1..100 is rejected")
  void list_rejectsBadLimit() {
    assertThatThrownBy(() -> service.list(user(1, true), 0, 0))
        .isInstanceOf(ServiceExceptions.BadRequestException.class);
    assertThatThrownBy(() -> service.list(user(1, true), 0, 101))
        .isInstanceOf(ServiceExceptions.BadRequestException.class);
  }

  // ========================================
  // SINGLE ACCOUNT ACCESS
  // ========================================

  @Test
  @DisplayName("a regular user cannot read another account")
  void get_otherAccountForbidden() {
    assertThatThrownBy(() -> service.get(user(1, false), 2L))
        .isInstanceOf(ServiceExceptions.ForbiddenException.class);
    verify(users, never()).findById(any());
  }

  @Test
  @DisplayName("superusers can read any account; missing ones are 404")
  void get_superuser() {
    when(users.findById(2L)).thenReturn(user(2, false));
    when(users.findById(3L)).thenReturn(null);

    assertThat(service.get(user(1, true), 2L).username).isEqualTo("user2");
    assertThatThrownBy(() -> service.get(user(1, true), 3L))
        .isInstanceOf(ServiceExceptions.NotFoundException.class);
  }

  @Test
  @DisplayName("a user cannot change their own account status")
  void update_activeRequiresSuperuser() {
    AppUser me = user(1, false);
    when(users.findById(1L)).thenReturn(me);

    assertThatThrownBy(() -> service.update(me, 1L, null, null, false))
        .isInstanceOf(ServiceExceptions.ForbiddenException.class);
    assertThat(me.active).isTrue();
  }

  @Test
  @DisplayName("superusers reactivate accounts but cannot deactivate themselves")
  void update_superuserStatusRules() {
    AppUser admin = user(1, true);
    AppUser other = user(2, false);
    other.active = false;
    when(users.findById(1L)).thenReturn(admin);
    when(users.findById(2L)).thenReturn(other);

    AccountDto reactivated = service.update(admin, 2L, null, null, true);

    assertThat(reactivated.active).isTrue();
    assertThat(other.active).isTrue();
    assertThatThrownBy(() -> service.update(admin, 1L, null, null, false))
        .isInstanceOf(ServiceExceptions.BadRequestException.class)
        .hasMessage("Superusers cannot deactivate themselves");
  }

  @Test
  @DisplayName("an email owned by someone else is a conflict")
  void update_duplicateEmail() {
    AppUser me = user(1, false);
    AppUser other = user(2, false);
    when(users.findById(1L)).thenReturn(me);
    when(users.findByEmail("taken@example.com")).thenReturn(other);

    assertThatThrownBy(() -> service.update(me, 1L, null, " taken@example.com ", null))
        .isInstanceOf(ServiceExceptions.ConflictException.class);
    assertThat(me.email).isNull();
  }

  @Test
  @DisplayName("usernames are lower-cased and restricted to a-z, 0-9 and underscore")
  void applyProfile_username() {
    AppUser me = user(1, false);
    when(users.findByUsername("new_name")).thenReturn(null);

    service.applyProfile(me, "New_Name", null);

    assertThat(me.username).isEqualTo("new_name");
    assertThatThrownBy(() -> service.applyProfile(me, "bad-name", null))
        .isInstanceOf(ServiceExceptions.BadRequestException.class);
  }

  // ========================================
  // DEACTIVATION
  // ========================================

  @Test
  @DisplayName("a user can deactivate their own account")
  void deactivate_self() {
    AppUser me = user(1, false);
    when(users.findById(1L)).thenReturn(me);

    service.deactivate(me, 1L);

    assertThat(me.active).isFalse();
  }

  @Test
  @DisplayName("a regular user cannot deactivate someone else")
  void deactivate_otherForbidden() {
    assertThatThrownBy(() -> service.deactivate(user(1, false), 2L))
        .isInstanceOf(ServiceExceptions.ForbiddenException.class);
  }
}
