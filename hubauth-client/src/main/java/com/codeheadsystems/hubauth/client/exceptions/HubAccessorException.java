package com.codeheadsystems.hubauth.client.exceptions;

/**
 * Base type for classified failures while asking the hub to verify a cookie.
 * <p>
 * Each subtype carries the HTTP status the hosting server should answer with. The message is
 * generic and safe to show to the end user; hub response bodies are never included.
 */
public class HubAccessorException extends RuntimeException {

  private final int responseStatus;

  /**
   * Instantiates a new Hub accessor exception.
   *
   * @param responseStatus the HTTP status to surface to the caller
   * @param message        the message
   * @param cause          the cause
   */
  public HubAccessorException(final int responseStatus, final String message, final Throwable cause) {
    super(message, cause);
    this.responseStatus = responseStatus;
  }

  /**
   * The HTTP status the hosting server should respond with.
   *
   * @return the status code
   */
  public int responseStatus() {
    return responseStatus;
  }
}
