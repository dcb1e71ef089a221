package com.codeheadsystems.hubauth.dropwizard;

import com.codeheadsystems.hubauth.server.cache.CookieCacheExpiry;
import io.dropwizard.lifecycle.Managed;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Ties the cookie cache expiry to the application lifecycle.
 */
public class CookieCacheExpiryManager implements Managed {

  private final CookieCacheExpiry expiry;
  private final ScheduledExecutorService scheduler;

  /**
   * Instantiates a new Cookie cache expiry manager.
   *
   * @param expiry    the expiry
   * @param scheduler a lifecycle-managed scheduler
   */
  public CookieCacheExpiryManager(CookieCacheExpiry expiry, ScheduledExecutorService scheduler) {
    this.expiry = expiry;
    this.scheduler = scheduler;
  }

  @Override
  public void start() {
    expiry.start(scheduler);
  }

  @Override
  public void stop() {
    expiry.stop();
  }
}
