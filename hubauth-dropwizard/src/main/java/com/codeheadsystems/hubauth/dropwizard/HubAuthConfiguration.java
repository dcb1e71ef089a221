package com.codeheadsystems.hubauth.dropwizard;

import com.codeheadsystems.hubauth.server.config.HubAuthSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.net.URI;
import java.time.Duration;

/**
 * Dropwizard configuration for a single-user server that authenticates through the hub.
 * <p>
 * The hub API key should not live in the YAML file; reference an environment variable instead
 * and enable {@code EnvironmentVariableSubstitutor} in the application's bootstrap:
 * <pre>{@code
 *   hubApiKey: ${JPY_API_TOKEN}
 * }</pre>
 */
public class HubAuthConfiguration extends Configuration {

  /**
   * The one hub user this server serves. Cookies belonging to anyone else are treated as anonymous.
   */
  @NotEmpty
  private String user;

  /**
   * Name of the hub's session cookie.
   */
  @NotEmpty
  private String cookieName = "jupyter-hub-token";

  /**
   * Base URL of the hub REST API, e.g. {@code http://127.0.0.1:8081/hub/api}.
   */
  @NotEmpty
  private String hubApiUrl;

  /**
   * API token this server presents to the hub.
   */
  @NotEmpty
  private String hubApiKey;

  /**
   * URL prefix of the hub, used for the login and logout redirects.
   */
  @NotEmpty
  private String hubPrefix = "/hub/";

  /**
   * Scheme and host of the hub as seen by browsers. Empty when the hub shares this server's origin.
   */
  private String hubHost = "";

  /**
   * Seconds between full clears of the cookie cache. 0 keeps verifications for the process lifetime.
   */
  @Min(0)
  private long cookieCacheLifetime = 300;

  /**
   * Upper bound in seconds for one verification call to the hub.
   */
  @Min(1)
  private long hubRequestTimeoutSeconds = 30;

  /**
   * Converts this configuration into the settings used by the core components.
   *
   * @return the hub auth settings
   */
  public HubAuthSettings toHubAuthSettings() {
    return new HubAuthSettings(user, cookieName, URI.create(hubApiUrl), hubApiKey, hubPrefix, hubHost,
        cookieCacheLifetime, Duration.ofSeconds(hubRequestTimeoutSeconds));
  }

  /**
   * Gets user.
   *
   * @return the user
   */
  @JsonProperty
  public String getUser() {
    return user;
  }

  /**
   * Sets user.
   *
   * @param user the user
   */
  @JsonProperty
  public void setUser(String user) {
    this.user = user;
  }

  /**
   * Gets cookie name.
   *
   * @return the cookie name
   */
  @JsonProperty
  public String getCookieName() {
    return cookieName;
  }

  /**
   * Sets cookie name.
   *
   * @param cookieName the cookie name
   */
  @JsonProperty
  public void setCookieName(String cookieName) {
    this.cookieName = cookieName;
  }

  /**
   * Gets hub api url.
   *
   * @return the hub api url
   */
  @JsonProperty
  public String getHubApiUrl() {
    return hubApiUrl;
  }

  /**
   * Sets hub api url.
   *
   * @param hubApiUrl the hub api url
   */
  @JsonProperty
  public void setHubApiUrl(String hubApiUrl) {
    this.hubApiUrl = hubApiUrl;
  }

  /**
   * Gets hub api key.
   *
   * @return the hub api key
   */
  @JsonProperty
  public String getHubApiKey() {
    return hubApiKey;
  }

  /**
   * Sets hub api key.
   *
   * @param hubApiKey the hub api key
   */
  @JsonProperty
  public void setHubApiKey(String hubApiKey) {
    this.hubApiKey = hubApiKey;
  }

  /**
   * Gets hub prefix.
   *
   * @return the hub prefix
   */
  @JsonProperty
  public String getHubPrefix() {
    return hubPrefix;
  }

  /**
   * Sets hub prefix.
   *
   * @param hubPrefix the hub prefix
   */
  @JsonProperty
  public void setHubPrefix(String hubPrefix) {
    this.hubPrefix = hubPrefix;
  }

  /**
   * Gets hub host.
   *
   * @return the hub host
   */
  @JsonProperty
  public String getHubHost() {
    return hubHost;
  }

  /**
   * Sets hub host.
   *
   * @param hubHost the hub host
   */
  @JsonProperty
  public void setHubHost(String hubHost) {
    this.hubHost = hubHost;
  }

  /**
   * Gets cookie cache lifetime.
   *
   * @return the cookie cache lifetime in seconds
   */
  @JsonProperty
  public long getCookieCacheLifetime() {
    return cookieCacheLifetime;
  }

  /**
   * Sets cookie cache lifetime.
   *
   * @param cookieCacheLifetime the cookie cache lifetime in seconds
   */
  @JsonProperty
  public void setCookieCacheLifetime(long cookieCacheLifetime) {
    this.cookieCacheLifetime = cookieCacheLifetime;
  }

  /**
   * Gets hub request timeout seconds.
   *
   * @return the hub request timeout seconds
   */
  @JsonProperty
  public long getHubRequestTimeoutSeconds() {
    return hubRequestTimeoutSeconds;
  }

  /**
   * Sets hub request timeout seconds.
   *
   * @param hubRequestTimeoutSeconds the hub request timeout seconds
   */
  @JsonProperty
  public void setHubRequestTimeoutSeconds(long hubRequestTimeoutSeconds) {
    this.hubRequestTimeoutSeconds = hubRequestTimeoutSeconds;
  }
}
