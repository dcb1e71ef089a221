package com.codeheadsystems.hubauth.client.model;

import java.net.URI;
import java.time.Duration;

/**
 * Network connection details for the hub's REST API.
 *
 * @param apiUrl         base URL of the hub API (e.g. http://127.0.0.1:8081/hub/api); path segments are
 *                       appended per endpoint
 * @param apiKey         API token this server presents to the hub in the {@code Authorization} header
 * @param requestTimeout upper bound for a single verification call; a timeout counts as an upstream failure
 */
public record HubConnectionInfo(URI apiUrl, String apiKey, Duration requestTimeout) {

  /**
   * Compact constructor, validates the connection details.
   */
  public HubConnectionInfo {
    if (apiUrl == null) {
      throw new IllegalArgumentException("Hub API URL is required");
    }
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("Hub API key is required");
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("Hub request timeout must be positive: " + requestTimeout);
    }
  }

  @Override
  public String toString() {
    // never print the API key
    return "HubConnectionInfo[apiUrl=" + apiUrl + ", requestTimeout=" + requestTimeout + "]";
  }
}
