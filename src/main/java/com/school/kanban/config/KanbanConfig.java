package com.school.kanban.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Application settings under the {@code kanban.} prefix.
 */
@ConfigMapping(prefix = "kanban")
public interface KanbanConfig {

  Auth auth();

  Realtime realtime();

  interface Auth {
    /**
     * JWT group that marks an identity as elevated (superuser on every board).
     */
    @WithDefault("kanban-admin")
    String superuserGroup();

    /**
     * Claim copied into the username of a user seen for the first time.
     */
    @WithDefault("preferred_username")
    String usernameClaim();
  }

  interface Realtime {
    /**
     * When true, removing a member or deleting a board also drops the cached
     * access and subscription entries after the corresponding event went out.
     */
    @WithDefault("true")
    boolean evictOnRevoke();

    /**
     * How long pending fan-out tasks may run on shutdown.
     */
    @WithDefault("5S")
    Duration shutdownTimeout();
  }
}
