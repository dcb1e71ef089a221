package com.codeheadsystems.hubauth.server.cache;

import java.util.Optional;

/**
 * Cache of hub verification outcomes keyed by the encrypted cookie value.
 * <p>
 * Implementations must be thread-safe. Entries are never evicted one by one; the whole cache
 * is cleared at once by {@link #clear()}, which must be safe to call while lookups and stores
 * are in flight on other threads.
 */
public interface CookieCache {

  /**
   * Looks up a previous outcome for the cookie value.
   *
   * @param cookieValue the encrypted cookie value
   * @return the cached outcome, or empty on a cache miss
   */
  Optional<VerificationOutcome> lookup(String cookieValue);

  /**
   * Stores or replaces the outcome for the cookie value.
   *
   * @param cookieValue the encrypted cookie value
   * @param outcome     the outcome, absent outcomes included
   */
  void store(String cookieValue, VerificationOutcome outcome);

  /**
   * Atomically replaces the contents with an empty cache.
   */
  void clear();

  /**
   * Number of cached outcomes.
   *
   * @return the size
   */
  int size();
}
