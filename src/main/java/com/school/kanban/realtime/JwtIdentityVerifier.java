package com.school.kanban.realtime;

import com.school.kanban.model.AppUser;
import com.school.kanban.service.AuthService;
import com.school.kanban.service.ServiceExceptions;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;

// Verifies the token with the mp.jwt.verify settings and upserts the local user.
@ApplicationScoped
public class JwtIdentityVerifier implements IdentityVerifier {

  @Inject JWTParser parser;
  @Inject AuthService auth;

  @Override
  public AuthenticatedUser verify(String token) throws AuthenticationFailedException {
    if (token == null || token.isBlank()) throw new AuthenticationFailedException("Missing token");

    JsonWebToken jwt;
    try {
      jwt = parser.parse(token);
    } catch (ParseException e) {
      throw new AuthenticationFailedException("Invalid token", e);
    }

    try {
      AppUser user = auth.upsertFromToken(jwt);
      return new AuthenticatedUser(user.id, user.superuser);
    } catch (ServiceExceptions.UnauthorizedException e) {
      throw new AuthenticationFailedException(e.getMessage(), e);
    }
  }
}
