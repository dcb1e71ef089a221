package com.codeheadsystems.hubauth.server.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link CookieCache} backed by a {@link ConcurrentHashMap}.
 * <p>
 * {@link #clear()} swaps in a fresh map instead of emptying the current one, so a reader that
 * grabbed the old map keeps a consistent view. A store racing with a clear may land in the old
 * map and be lost; the next lookup simply misses and re-verifies.
 */
public class InMemoryCookieCache implements CookieCache {

  private static final Logger log = LoggerFactory.getLogger(InMemoryCookieCache.class);

  private final AtomicReference<ConcurrentHashMap<String, VerificationOutcome>> entries =
      new AtomicReference<>(new ConcurrentHashMap<>());

  @Override
  public Optional<VerificationOutcome> lookup(String cookieValue) {
    return Optional.ofNullable(entries.get().get(cookieValue));
  }

  @Override
  public void store(String cookieValue, VerificationOutcome outcome) {
    entries.get().put(cookieValue, outcome);
  }

  @Override
  public void clear() {
    ConcurrentHashMap<String, VerificationOutcome> previous = entries.getAndSet(new ConcurrentHashMap<>());
    log.debug("Cleared {} cached cookie verification(s)", previous.size());
  }

  @Override
  public int size() {
    return entries.get().size();
  }
}
