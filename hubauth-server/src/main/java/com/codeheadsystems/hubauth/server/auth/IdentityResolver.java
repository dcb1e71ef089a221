package com.codeheadsystems.hubauth.server.auth;

import com.codeheadsystems.hubauth.model.AuthorizationRecord;
import com.codeheadsystems.hubauth.server.config.HubAuthSettings;
import com.codeheadsystems.hubauth.server.manager.TokenVerifier;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CurrentIdentityResolver} backed by the hub session cookie.
 * <p>
 * A request is authenticated only if it carries the hub cookie, the hub recognizes it, and the
 * cookie belongs to the one user this server is provisioned for. Everything else is anonymous:
 * a missing cookie, a cookie the hub does not know, and a valid cookie of some other user all
 * look the same to the caller.
 */
@Singleton
public class IdentityResolver implements CurrentIdentityResolver {

  private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

  private final TokenVerifier tokenVerifier;
  private final String cookieName;
  private final String expectedIdentity;

  /**
   * Instantiates a new Identity resolver.
   *
   * @param tokenVerifier the token verifier
   * @param settings      the settings
   */
  @Inject
  public IdentityResolver(final TokenVerifier tokenVerifier, final HubAuthSettings settings) {
    log.info("IdentityResolver(user={}, cookieName={})", settings.expectedIdentity(), settings.cookieName());
    this.tokenVerifier = tokenVerifier;
    this.cookieName = settings.cookieName();
    this.expectedIdentity = settings.expectedIdentity();
  }

  @Override
  public Optional<String> currentIdentity(final RequestResolutionContext context) {
    return context.resolveOnce(() -> resolve(context.request()));
  }

  private Optional<String> resolve(final InboundRequest request) {
    Optional<String> cookieValue = request.cookie(cookieName).filter(value -> !value.isBlank());
    if (cookieValue.isEmpty()) {
      log.debug("No {} cookie on request", cookieName);
      return Optional.empty();
    }
    Optional<AuthorizationRecord> record = tokenVerifier.verify(cookieName, cookieValue.get());
    if (record.isEmpty()) {
      return Optional.empty();
    }
    String name = record.get().name();
    if (expectedIdentity.equals(name)) {
      return Optional.of(name);
    }
    log.warn("Rejecting hub cookie that does not belong to {}", expectedIdentity);
    return Optional.empty();
  }
}
