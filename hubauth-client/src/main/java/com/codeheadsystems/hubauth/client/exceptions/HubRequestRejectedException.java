package com.codeheadsystems.hubauth.client.exceptions;

/**
 * The hub rejected the verification request as malformed (4xx other than 403/404).
 * Indicates a configuration or programming error on this side.
 */
public class HubRequestRejectedException extends HubAccessorException {

  /**
   * The message surfaced to the caller.
   */
  public static final String MESSAGE = "Failed to check authorization";

  private final int hubStatus;

  /**
   * Instantiates a new Hub request rejected exception.
   *
   * @param hubStatus the status the hub answered with
   */
  public HubRequestRejectedException(final int hubStatus) {
    super(500, MESSAGE, null);
    this.hubStatus = hubStatus;
  }

  /**
   * The status the hub answered with.
   *
   * @return the hub status
   */
  public int hubStatus() {
    return hubStatus;
  }
}
