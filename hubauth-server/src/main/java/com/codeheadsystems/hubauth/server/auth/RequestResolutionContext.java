package com.codeheadsystems.hubauth.server.auth;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Request-scoped holder for the outcome of identity resolution.
 * <p>
 * Create one per inbound request and drop it when the request ends. The first
 * {@link #resolveOnce(Supplier)} runs the resolution; every later call in the same request
 * replays its outcome, identity, anonymous, or the same exception, without touching the hub or
 * logging again. This matters when error pages ask for the current user while handling a
 * failure that identity resolution itself raised.
 */
public final class RequestResolutionContext {

  private final InboundRequest request;
  private boolean resolved;
  private String identity;
  private RuntimeException failure;

  /**
   * Instantiates a new Request resolution context.
   *
   * @param request the inbound request
   */
  public RequestResolutionContext(final InboundRequest request) {
    this.request = request;
  }

  /**
   * The inbound request.
   *
   * @return the request
   */
  public InboundRequest request() {
    return request;
  }

  /**
   * Whether resolution already ran for this request.
   *
   * @return true if resolved
   */
  public synchronized boolean isResolved() {
    return resolved;
  }

  /**
   * Runs the resolution the first time, replays its outcome afterwards.
   *
   * @param resolution the resolution to run
   * @return the identity, or empty when anonymous
   */
  public synchronized Optional<String> resolveOnce(final Supplier<Optional<String>> resolution) {
    if (!resolved) {
      try {
        identity = resolution.get().orElse(null);
      } catch (RuntimeException e) {
        failure = e;
      }
      resolved = true;
    }
    if (failure != null) {
      throw failure;
    }
    return Optional.ofNullable(identity);
  }
}
