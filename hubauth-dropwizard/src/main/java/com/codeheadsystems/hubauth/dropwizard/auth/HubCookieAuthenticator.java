package com.codeheadsystems.hubauth.dropwizard.auth;

import com.codeheadsystems.hubauth.server.auth.CurrentIdentityResolver;
import com.codeheadsystems.hubauth.server.auth.RequestResolutionContext;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that resolves the caller through a {@link CurrentIdentityResolver}.
 * <p>
 * Classified hub failures are runtime exceptions and pass through unchanged, so the host's exception
 * mapper can answer 500 or 502 instead of Dropwizard's generic authentication error.
 */
public class HubCookieAuthenticator implements Authenticator<RequestResolutionContext, HubPrincipal> {

  private final CurrentIdentityResolver identityResolver;

  /**
   * Instantiates a new Hub cookie authenticator.
   *
   * @param identityResolver the identity resolver
   */
  public HubCookieAuthenticator(CurrentIdentityResolver identityResolver) {
    this.identityResolver = identityResolver;
  }

  @Override
  public Optional<HubPrincipal> authenticate(RequestResolutionContext context) {
    return identityResolver.currentIdentity(context).map(HubPrincipal::new);
  }
}
