package com.codeheadsystems.hubauth.server.auth;

import java.util.Optional;

/**
 * Extension point: who is making the current request.
 * <p>
 * Hosts call this on every authenticated request path. Implementations return the caller's
 * identity or empty for anonymous; they throw only for operational failures that the host should
 * turn into an error response.
 */
@FunctionalInterface
public interface CurrentIdentityResolver {

  /**
   * Resolves the caller of the request.
   *
   * @param context the request-scoped context
   * @return the identity, or empty when the caller is anonymous
   */
  Optional<String> currentIdentity(RequestResolutionContext context);
}
