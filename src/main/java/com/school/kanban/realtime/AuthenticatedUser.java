package com.school.kanban.realtime;

// Identity bound to a socket for its whole lifetime.
public record AuthenticatedUser(long userId, boolean elevated) {}
