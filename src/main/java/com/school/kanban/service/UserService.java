package com.school.kanban.service;

import com.school.kanban.api.dto.AccountDto;
import com.school.kanban.model.AppUser;
import com.school.kanban.repo.AppUserRepository;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Account administration.
 * A user may read, edit and deactivate their own account; superusers may do so for any account
 * and are the only ones who can list accounts or reactivate one.
 */
@ApplicationScoped
public class UserService {

  private static final Logger LOG = Logger.getLogger(UserService.class);

  static final int MAX_PAGE = 100;

  @Inject AppUserRepository users;

  @Transactional
  public List<AccountDto> list(AppUser actor, int skip, int limit) {
    if (!actor.superuser) throw new ServiceExceptions.ForbiddenException("Not enough permissions");
    if (skip < 0) throw new ServiceExceptions.BadRequestException("skip must not be negative");
    if (limit < 1 || limit > MAX_PAGE) {
      throw new ServiceExceptions.BadRequestException("limit must be between 1 and " + MAX_PAGE);
    }
    return users.listPage(skip, limit).stream().map(UserService::toDto).collect(Collectors.toList());
  }

  @Transactional
  public AccountDto get(AppUser actor, Long userId) {
    return toDto(requireAccount(actor, userId));
  }

  @Transactional
  public AccountDto update(AppUser actor, Long userId, String username, String email, Boolean active) {
    AppUser target = requireAccount(actor, userId);
    applyProfile(target, username, email);

    if (active != null && active != target.active) {
      if (!actor.superuser) {
        throw new ServiceExceptions.ForbiddenException("Only superusers can change account status");
      }
      if (!active && target.id.equals(actor.id)) {
        throw new ServiceExceptions.BadRequestException("Superusers cannot deactivate themselves");
      }
      target.active = active;
      LOG.infof("User %d set active=%s by user %d", target.id, active, actor.id);
    }
    return toDto(target);
  }

  // Deactivated accounts are refused on their next request or socket handshake.
  @Transactional
  public void deactivate(AppUser actor, Long userId) {
    AppUser target = requireAccount(actor, userId);
    if (!target.active) return;
    target.active = false;
    LOG.infof("User %d deactivated by user %d", target.id, actor.id);
  }

  /**
   * Validates and applies a username and email change.
   * Null leaves a field untouched; a blank email clears it.
   */
  void applyProfile(AppUser u, String username, String email) {
    if (username != null) {
      username = username.trim().toLowerCase();
      if (username.length() < 3 || username.length() > 64) {
        throw new ServiceExceptions.BadRequestException("username must be 3-64 characters");
      }
      if (!isValidUsername(username)) {
        throw new ServiceExceptions.BadRequestException("username may contain only a-z, 0-9 and underscore");
      }
      AppUser other = users.findByUsername(username);
      if (other != null && !other.id.equals(u.id)) {
        throw new ServiceExceptions.ConflictException("username already taken");
      }
      u.username = username;
    }

    if (email != null) {
      email = email.trim();
      if (!email.isEmpty() && !email.contains("@")) {
        throw new ServiceExceptions.BadRequestException("email is not valid");
      }
      if (!email.isEmpty()) {
        AppUser other = users.findByEmail(email);
        if (other != null && !other.id.equals(u.id)) {
          throw new ServiceExceptions.ConflictException("email already registered");
        }
      }
      u.email = email.isEmpty() ? null : email;
    }
  }

  private AppUser requireAccount(AppUser actor, Long userId) {
    if (!actor.superuser && !actor.id.equals(userId)) {
      throw new ServiceExceptions.ForbiddenException("Not enough permissions");
    }
    AppUser target = users.findById(userId);
    if (target == null) throw new ServiceExceptions.NotFoundException("User not found");
    return target;
  }

  static boolean isValidUsername(String username) {
    return username.length() >= 3 && username.length() <= 64 && username.matches("[a-z0-9_]+");
  }

  static AccountDto toDto(AppUser u) {
    AccountDto d = new AccountDto();
    d.id = u.id;
    d.subject = u.subject;
    d.username = u.username;
    d.email = u.email;
    d.superuser = u.superuser;
    d.active = u.active;
    d.createdAt = u.createdAt;
    return d;
  }
}
