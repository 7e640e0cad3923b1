package com.school.kanban.realtime;

/**
 * Resolves the bearer token a socket presented at connect time.
 */
public interface IdentityVerifier {

  AuthenticatedUser verify(String token) throws AuthenticationFailedException;
}
