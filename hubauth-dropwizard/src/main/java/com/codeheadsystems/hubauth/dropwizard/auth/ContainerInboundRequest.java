package com.codeheadsystems.hubauth.dropwizard.auth;

import com.codeheadsystems.hubauth.server.auth.InboundRequest;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Cookie;
import java.util.Optional;

/**
 * {@link InboundRequest} view of a Jersey request.
 */
public class ContainerInboundRequest implements InboundRequest {

  private final ContainerRequestContext requestContext;

  /**
   * Instantiates a new Container inbound request.
   *
   * @param requestContext the jersey request context
   */
  public ContainerInboundRequest(ContainerRequestContext requestContext) {
    this.requestContext = requestContext;
  }

  @Override
  public Optional<String> cookie(String name) {
    return Optional.ofNullable(requestContext.getCookies().get(name)).map(Cookie::getValue);
  }
}
