package com.codeheadsystems.hubauth.server.auth;

import com.codeheadsystems.hubauth.server.config.HubAuthSettings;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.URI;

/**
 * Logs out by sending the browser to the hub, which owns the session cookie.
 */
@Singleton
public class HubLogoutAction implements LogoutAction {

  private final URI logoutLocation;

  /**
   * Instantiates a new Hub logout action.
   *
   * @param settings the settings
   */
  @Inject
  public HubLogoutAction(final HubAuthSettings settings) {
    this.logoutLocation = settings.logoutLocation();
  }

  @Override
  public URI logoutLocation() {
    return logoutLocation;
  }
}
