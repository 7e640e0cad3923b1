package com.school.kanban.service;

import com.school.kanban.config.KanbanConfig;
import com.school.kanban.model.AppUser;
import com.school.kanban.repo.AppUserRepository;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

  @Mock private JsonWebToken jwt;
  @Mock private AppUserRepository users;
  @Mock private KanbanConfig config;
  @Mock private KanbanConfig.Auth authConfig;
  @Mock private UserService accounts;

  @InjectMocks
  private AuthService service;

  @BeforeEach
  void setUp() {
    when(config.auth()).thenReturn(authConfig);
    when(authConfig.superuserGroup()).thenReturn("kanban-admin");
  }

  private static AppUser existing(boolean active) {
    AppUser u = new AppUser();
    u.id = 7L;
    u.subject = "sub-7";
    u.active = active;
    return u;
  }

  @Test
  @DisplayName("a deactivated account is refused even with a valid token")
  void upsert_refusesInactiveUser() {
    when(jwt.getSubject()).thenReturn("sub-7");
    when(jwt.getGroups()).thenReturn(Set.of());
    when(users.findBySubject("sub-7")).thenReturn(existing(false));

    assertThatThrownBy(() -> service.upsertFromToken(jwt))
        .isInstanceOf(ServiceExceptions.UnauthorizedException.class)
        .hasMessage("User is inactive");
  }

  @Test
  @DisplayName("the superuser flag follows the token groups")
  void upsert_syncsSuperuserFlag() {
    AppUser u = existing(true);
    when(jwt.getSubject()).thenReturn("sub-7");
    when(jwt.getGroups()).thenReturn(Set.of("kanban-admin"));
    when(users.findBySubject("sub-7")).thenReturn(u);

    AppUser resolved = service.upsertFromToken(jwt);

    assertThat(resolved).isSameAs(u);
    assertThat(u.superuser).isTrue();
    verify(users, never()).persist(any(AppUser.class));
  }
}
