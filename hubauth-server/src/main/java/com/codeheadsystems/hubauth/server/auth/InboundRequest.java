package com.codeheadsystems.hubauth.server.auth;

import java.util.Optional;

/**
 * The part of a hosting framework's request that identity resolution needs.
 */
@FunctionalInterface
public interface InboundRequest {

  /**
   * Reads a cookie from the request.
   *
   * @param name the cookie name
   * @return the cookie value, or empty if the request does not carry it
   */
  Optional<String> cookie(String name);
}
