package com.codeheadsystems.hubauth.server.cache;

import com.codeheadsystems.hubauth.server.config.HubAuthSettings;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically clears the whole {@link CookieCache}, so a session revoked at the hub stops being
 * trusted here after at most one cache lifetime.
 * <p>
 * The scheduler is supplied by the host so that it can manage its lifecycle. With a lifetime of
 * zero nothing is scheduled and cached outcomes live as long as the process.
 */
@Singleton
public class CookieCacheExpiry {

  private static final Logger log = LoggerFactory.getLogger(CookieCacheExpiry.class);

  private final CookieCache cache;
  private final long lifetimeSeconds;
  private ScheduledFuture<?> clearTask;

  /**
   * Instantiates a new Cookie cache expiry.
   *
   * @param cache    the cache to clear
   * @param settings the settings providing the cache lifetime
   */
  @Inject
  public CookieCacheExpiry(final CookieCache cache, final HubAuthSettings settings) {
    this.cache = cache;
    this.lifetimeSeconds = settings.cookieCacheLifetimeSeconds();
  }

  /**
   * Schedules the repeating clear.
   *
   * @param scheduler the scheduler to run the clear on
   * @return true if a clear was scheduled, false if expiry is disabled
   * @throws IllegalStateException if already started
   */
  public synchronized boolean start(final ScheduledExecutorService scheduler) {
    if (lifetimeSeconds == 0) {
      log.warn("Cookie cache lifetime is 0: cached verifications never expire "
          + "and revoked sessions stay trusted until restart.");
      return false;
    }
    if (clearTask != null) {
      throw new IllegalStateException("Cookie cache expiry already started");
    }
    long periodMillis = TimeUnit.SECONDS.toMillis(lifetimeSeconds);
    clearTask = scheduler.scheduleAtFixedRate(this::expire, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    log.info("Clearing cookie cache every {}s", lifetimeSeconds);
    return true;
  }

  /**
   * Cancels the repeating clear, if running.
   */
  public synchronized void stop() {
    if (clearTask != null) {
      clearTask.cancel(false);
      clearTask = null;
      log.info("Stopped cookie cache expiry");
    }
  }

  /**
   * Whether a clear is currently scheduled.
   *
   * @return true if running
   */
  public synchronized boolean isRunning() {
    return clearTask != null;
  }

  void expire() {
    cache.clear();
  }
}
