package com.school.kanban.api;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

// Logs method, path, status and elapsed time of every REST request.
@Provider
public class RequestLoggingFilter implements ContainerRequestFilter, ContainerResponseFilter {

  private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);
  private static final String STARTED = RequestLoggingFilter.class.getName() + ".started";

  @Override
  public void filter(ContainerRequestContext request) {
    request.setProperty(STARTED, System.nanoTime());
  }

  @Override
  public void filter(ContainerRequestContext request, ContainerResponseContext response) {
    Object started = request.getProperty(STARTED);
    long elapsedMs = started instanceof Long ? (System.nanoTime() - (Long) started) / 1_000_000 : -1;
    LOG.infof("%s %s -> %d (%d ms)", request.getMethod(), request.getUriInfo().getPath(),
        response.getStatus(), elapsedMs);
  }
}
