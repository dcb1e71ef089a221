package com.codeheadsystems.hubauth.server.manager;

import com.codeheadsystems.hubauth.client.accessor.HubAuthorizationAccessor;
import com.codeheadsystems.hubauth.client.exceptions.HubCredentialRejectedException;
import com.codeheadsystems.hubauth.model.AuthorizationRecord;
import com.codeheadsystems.hubauth.server.cache.CookieCache;
import com.codeheadsystems.hubauth.server.cache.VerificationOutcome;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an encrypted hub cookie into an {@link AuthorizationRecord}.
 * <p>
 * Cache hits are answered from memory. On a miss the hub is asked exactly once and its answer,
 * including "not a valid session", is cached until the next full cache clear. Classified
 * failures from {@link HubAuthorizationAccessor} propagate unchanged and are not cached, so the
 * next request tries the hub again.
 */
@Singleton
public class TokenVerifier {

  private static final Logger log = LoggerFactory.getLogger(TokenVerifier.class);

  private final HubAuthorizationAccessor accessor;
  private final CookieCache cache;
  private final HubCredentialStatus credentialStatus;

  /**
   * Instantiates a new Token verifier.
   *
   * @param accessor         the hub accessor
   * @param cache            the cookie cache
   * @param credentialStatus tracker for the hub's view of our API token
   */
  @Inject
  public TokenVerifier(final HubAuthorizationAccessor accessor,
                       final CookieCache cache,
                       final HubCredentialStatus credentialStatus) {
    log.info("TokenVerifier()");
    this.accessor = accessor;
    this.cache = cache;
    this.credentialStatus = credentialStatus;
  }

  /**
   * Verifies a hub session cookie.
   *
   * @param cookieName  the cookie name
   * @param cookieValue the encrypted cookie value, never blank
   * @return the authorization record, or empty if the hub does not recognize the cookie
   * @throws com.codeheadsystems.hubauth.client.exceptions.HubAccessorException on a classified hub failure
   */
  public Optional<AuthorizationRecord> verify(final String cookieName, final String cookieValue) {
    if (cookieValue == null || cookieValue.isBlank()) {
      throw new IllegalArgumentException("cookieValue must not be blank");
    }
    Optional<VerificationOutcome> cached = cache.lookup(cookieValue);
    if (cached.isPresent()) {
      log.debug("Cookie cache hit (absent={})", cached.get().isAbsent());
      return cached.get().authorization();
    }

    Optional<AuthorizationRecord> fetched;
    try {
      fetched = accessor.fetchCookieAuthorization(cookieName, cookieValue);
    } catch (HubCredentialRejectedException e) {
      credentialStatus.markRejected();
      throw e;
    }
    credentialStatus.markAccepted();
    cache.store(cookieValue, VerificationOutcome.of(fetched));
    return fetched;
  }
}
