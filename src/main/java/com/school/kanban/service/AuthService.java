package com.school.kanban.service;

import com.school.kanban.api.dto.MeResponse;
import com.school.kanban.config.KanbanConfig;
import com.school.kanban.model.AppUser;
import com.school.kanban.repo.AppUserRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Set;

@ApplicationScoped
public class AuthService {

  private static final Logger LOG = Logger.getLogger(AuthService.class);

  @Inject JsonWebToken jwt;
  @Inject AppUserRepository users;
  @Inject KanbanConfig config;
  @Inject UserService accounts;

  @Transactional
  public AppUser upsertCurrentUser() {
    return upsertFromToken(jwt);
  }

  /**
   * Resolves a verified token to the local user row, creating it on first sight.
   * The superuser flag follows the token's groups on every call.
   */
  @Transactional
  public AppUser upsertFromToken(JsonWebToken token) {
    String subject = token.getSubject();
    if (subject == null || subject.isBlank()) {
      throw new ServiceExceptions.UnauthorizedException("JWT missing sub claim (subject)");
    }

    Set<String> groups = token.getGroups();
    boolean elevated = groups != null && groups.contains(config.auth().superuserGroup());

    AppUser existing = users.findBySubject(subject);
    if (existing != null) {
      if (!existing.active) throw new ServiceExceptions.UnauthorizedException("User is inactive");
      if (existing.superuser != elevated) {
        LOG.infof("User %d superuser flag changed to %s", existing.id, elevated);
        existing.superuser = elevated;
      }
      return existing;
    }

    AppUser u = new AppUser();
    u.subject = subject;
    u.username = initialUsername(token);
    u.email = token.getClaim("email");
    u.superuser = elevated;
    u.active = true;
    u.createdAt = Instant.now();
    users.persist(u);
    LOG.infof("Registered user %d for subject %s", u.id, subject);
    return u;
  }

  // Claim value is used only when it is a valid, free username.
  private String initialUsername(JsonWebToken token) {
    Object claim = token.getClaim(config.auth().usernameClaim());
    if (claim == null) return null;
    String candidate = claim.toString().trim().toLowerCase();
    if (!UserService.isValidUsername(candidate)) return null;
    return users.findByUsername(candidate) == null ? candidate : null;
  }

  @Transactional
  public MeResponse me() {
    return toMe(upsertCurrentUser());
  }

  @Transactional
  public MeResponse updateMe(String username, String email) {
    AppUser u = upsertCurrentUser();
    accounts.applyProfile(u, username, email);
    return toMe(u);
  }

  static MeResponse toMe(AppUser u) {
    MeResponse r = new MeResponse();
    r.id = u.id;
    r.subject = u.subject;
    r.username = u.username;
    r.email = u.email;
    r.superuser = u.superuser;
    return r;
  }
}
