package com.codeheadsystems.hubauth.server.auth;

import java.net.URI;

/**
 * Extension point: what logging out means for this server.
 * <p>
 * Hosts answer their logout route with a redirect to {@link #logoutLocation()} instead of
 * clearing any local session.
 */
@FunctionalInterface
public interface LogoutAction {

  /**
   * Where to send the browser on logout.
   *
   * @return the redirect target
   */
  URI logoutLocation();
}
