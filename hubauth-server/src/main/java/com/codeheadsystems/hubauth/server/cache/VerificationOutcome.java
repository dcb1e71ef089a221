package com.codeheadsystems.hubauth.server.cache;

import com.codeheadsystems.hubauth.model.AuthorizationRecord;
import java.util.Optional;

/**
 * What the hub said about one cookie: either who it belongs to, or that it is not a valid
 * session. Absent outcomes are cached as well so garbage cookies do not hit the hub repeatedly.
 *
 * @param authorizationRecord the record, or null when the hub did not recognize the cookie
 */
public record VerificationOutcome(AuthorizationRecord authorizationRecord) {

  private static final VerificationOutcome ABSENT = new VerificationOutcome(null);

  /**
   * The outcome for an unrecognized cookie.
   *
   * @return the absent outcome
   */
  public static VerificationOutcome absent() {
    return ABSENT;
  }

  /**
   * Wraps a fetch result.
   *
   * @param authorization the record, or empty
   * @return the outcome
   */
  public static VerificationOutcome of(Optional<AuthorizationRecord> authorization) {
    return authorization.map(VerificationOutcome::new).orElse(ABSENT);
  }

  /**
   * The record, if the cookie was valid.
   *
   * @return the authorization
   */
  public Optional<AuthorizationRecord> authorization() {
    return Optional.ofNullable(authorizationRecord);
  }

  /**
   * Whether the hub did not recognize the cookie.
   *
   * @return true if absent
   */
  public boolean isAbsent() {
    return authorizationRecord == null;
  }
}
