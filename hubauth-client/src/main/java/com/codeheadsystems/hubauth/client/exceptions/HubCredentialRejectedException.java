package com.codeheadsystems.hubauth.client.exceptions;

/**
 * The hub answered 403: this server's own API token is invalid or expired.
 * <p>
 * Nothing a retry can fix. The server should be considered unhealthy and restarted by its
 * supervisor with a fresh token.
 */
public class HubCredentialRejectedException extends HubAccessorException {

  /**
   * The message surfaced to the caller.
   */
  public static final String MESSAGE =
      "Permission failure checking authorization, I may need to be restarted";

  /**
   * Instantiates a new Hub credential rejected exception.
   */
  public HubCredentialRejectedException() {
    super(500, MESSAGE, null);
  }
}
