package com.codeheadsystems.hubauth.server.config;

import com.codeheadsystems.hubauth.client.model.HubConnectionInfo;
import java.net.URI;
import java.time.Duration;

/**
 * Immutable settings for hub cookie authentication, built once at startup and handed to every
 * component that needs them.
 *
 * @param expectedIdentity           the single user this server instance serves
 * @param cookieName                 name of the hub session cookie
 * @param hubApiUrl                  base URL of the hub REST API
 * @param hubApiKey                  API token this server presents to the hub
 * @param hubPrefix                  URL prefix of the hub (e.g. {@code /hub/})
 * @param hubHost                    scheme and host of the hub as seen by browsers; empty when the hub
 *                                   shares this server's origin
 * @param cookieCacheLifetimeSeconds seconds between full clears of the cookie cache; 0 disables expiry
 * @param hubRequestTimeout          upper bound for one verification call
 */
public record HubAuthSettings(
    String expectedIdentity,
    String cookieName,
    URI hubApiUrl,
    String hubApiKey,
    String hubPrefix,
    String hubHost,
    long cookieCacheLifetimeSeconds,
    Duration hubRequestTimeout) {

  /**
   * Compact constructor, validates the settings.
   */
  public HubAuthSettings {
    requireText(expectedIdentity, "expectedIdentity");
    requireText(cookieName, "cookieName");
    requireText(hubApiKey, "hubApiKey");
    requireText(hubPrefix, "hubPrefix");
    if (hubApiUrl == null) {
      throw new IllegalArgumentException("hubApiUrl is required");
    }
    if (cookieCacheLifetimeSeconds < 0) {
      throw new IllegalArgumentException(
          "cookieCacheLifetimeSeconds must be >= 0: " + cookieCacheLifetimeSeconds);
    }
    hubHost = hubHost == null ? "" : hubHost;
  }

  /**
   * Connection details for the hub accessor.
   *
   * @return the hub connection info
   */
  public HubConnectionInfo hubConnectionInfo() {
    return new HubConnectionInfo(hubApiUrl, hubApiKey, hubRequestTimeout);
  }

  /**
   * Where anonymous browsers are sent to log in: {@code {hubHost}{hubPrefix}/login}.
   *
   * @return the login location
   */
  public URI loginLocation() {
    return hubLocation("login");
  }

  /**
   * Where logout redirects to: {@code {hubHost}{hubPrefix}/logout}.
   *
   * @return the logout location
   */
  public URI logoutLocation() {
    return hubLocation("logout");
  }

  private URI hubLocation(String page) {
    String prefix = hubPrefix.startsWith("/") ? hubPrefix : "/" + hubPrefix;
    String host = hubHost.endsWith("/") ? hubHost.substring(0, hubHost.length() - 1) : hubHost;
    return URI.create(host + (prefix.endsWith("/") ? prefix : prefix + "/") + page);
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  @Override
  public String toString() {
    return "HubAuthSettings[expectedIdentity=" + expectedIdentity
        + ", cookieName=" + cookieName
        + ", hubApiUrl=" + hubApiUrl
        + ", hubPrefix=" + hubPrefix
        + ", hubHost=" + hubHost
        + ", cookieCacheLifetimeSeconds=" + cookieCacheLifetimeSeconds
        + ", hubRequestTimeout=" + hubRequestTimeout + "]";
  }
}
