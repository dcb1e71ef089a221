package com.codeheadsystems.hubauth.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing the hub user this server serves.
 *
 * @param name the hub user name
 */
public record HubPrincipal(String name) implements Principal {

  @Override
  public String getName() {
    return name;
  }
}
