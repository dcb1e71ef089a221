package com.codeheadsystems.hubauth.client.exceptions;

/**
 * The hub is down, failing (5xx), timed out, or the connection dropped. Safe to retry on a
 * later request.
 */
public class HubUnavailableException extends HubAccessorException {

  /**
   * The message surfaced to the caller.
   */
  public static final String MESSAGE = "Failed to check authorization";

  /**
   * Instantiates a new Hub unavailable exception.
   *
   * @param cause the cause, null when the hub answered with a 5xx status
   */
  public HubUnavailableException(final Throwable cause) {
    super(502, MESSAGE, cause);
  }
}
