package com.codeheadsystems.hubauth.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.hubauth.server.manager.HubCredentialStatus;
import java.time.Instant;
import java.util.Optional;

/**
 * Health check that turns unhealthy while the hub rejects this server's API token. Only a restart
 * with a fresh token fixes that.
 */
public class HubCredentialHealthCheck extends HealthCheck {

  private final HubCredentialStatus credentialStatus;

  /**
   * Instantiates a new Hub credential health check.
   *
   * @param credentialStatus the credential status
   */
  public HubCredentialHealthCheck(HubCredentialStatus credentialStatus) {
    this.credentialStatus = credentialStatus;
  }

  @Override
  protected Result check() {
    Optional<Instant> rejectedSince = credentialStatus.rejectedSince();
    if (rejectedSince.isPresent()) {
      return Result.unhealthy("Hub has rejected our API token since %s", rejectedSince.get());
    }
    return Result.healthy();
  }
}
