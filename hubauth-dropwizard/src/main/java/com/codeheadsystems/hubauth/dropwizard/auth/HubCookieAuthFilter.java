package com.codeheadsystems.hubauth.dropwizard.auth;

import com.codeheadsystems.hubauth.server.auth.RequestResolutionContext;
import io.dropwizard.auth.AuthFilter;
import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;

/**
 * Jersey auth filter that authenticates requests by the hub session cookie.
 * <p>
 * The {@link RequestResolutionContext} lives in a request property, so every lookup of the current
 * user during one request, including ones made while rendering an error, shares a single
 * resolution. Jersey drops the property when the request ends.
 */
@Priority(Priorities.AUTHENTICATION)
public class HubCookieAuthFilter extends AuthFilter<RequestResolutionContext, HubPrincipal> {

  /**
   * Request property holding the request's {@link RequestResolutionContext}.
   */
  public static final String RESOLUTION_PROPERTY = "hubauth.resolution";

  /**
   * Authentication scheme reported by the security context.
   */
  public static final String AUTHENTICATION_SCHEME = "HubCookie";

  private HubCookieAuthFilter() {
  }

  /**
   * Returns the resolution context of the request, creating it on first use.
   *
   * @param requestContext the jersey request context
   * @return the request's resolution context
   */
  public static RequestResolutionContext resolutionContext(ContainerRequestContext requestContext) {
    Object existing = requestContext.getProperty(RESOLUTION_PROPERTY);
    if (existing instanceof RequestResolutionContext context) {
      return context;
    }
    RequestResolutionContext context = new RequestResolutionContext(new ContainerInboundRequest(requestContext));
    requestContext.setProperty(RESOLUTION_PROPERTY, context);
    return context;
  }

  @Override
  public void filter(ContainerRequestContext requestContext) {
    if (!authenticate(requestContext, resolutionContext(requestContext), AUTHENTICATION_SCHEME)) {
      throw new WebApplicationException(unauthorizedResponse(requestContext));
    }
  }

  private Response unauthorizedResponse(ContainerRequestContext requestContext) {
    if (unauthorizedHandler instanceof HubLoginRedirectHandler loginRedirect) {
      return loginRedirect.buildResponse(requestContext);
    }
    return unauthorizedHandler.buildResponse(prefix, realm);
  }

  /**
   * Builder for {@link HubCookieAuthFilter}.
   */
  public static class Builder extends AuthFilterBuilder<RequestResolutionContext, HubPrincipal, HubCookieAuthFilter> {

    @Override
    protected HubCookieAuthFilter newInstance() {
      return new HubCookieAuthFilter();
    }
  }
}
