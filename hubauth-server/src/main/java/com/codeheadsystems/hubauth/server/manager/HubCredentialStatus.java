package com.codeheadsystems.hubauth.server.manager;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks whether the hub currently accepts this server's API token.
 * <p>
 * Flipped to rejected on a 403 from the hub and back to accepted on the next answer the hub
 * gives with our token (a record or a 404). Hosts expose it as a health check so a supervisor
 * can restart the server with a fresh token.
 */
public class HubCredentialStatus {

  private final AtomicReference<Instant> rejectedSince = new AtomicReference<>();

  /**
   * Records that the hub rejected our token. Keeps the time of the first rejection.
   */
  public void markRejected() {
    rejectedSince.compareAndSet(null, Instant.now());
  }

  /**
   * Records that the hub accepted our token.
   */
  public void markAccepted() {
    rejectedSince.set(null);
  }

  /**
   * When the hub started rejecting our token.
   *
   * @return the first rejection time, or empty while the token is accepted
   */
  public Optional<Instant> rejectedSince() {
    return Optional.ofNullable(rejectedSince.get());
  }
}
