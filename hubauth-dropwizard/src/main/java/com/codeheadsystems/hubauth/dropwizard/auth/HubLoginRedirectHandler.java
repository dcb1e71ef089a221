package com.codeheadsystems.hubauth.dropwizard.auth;

import io.dropwizard.auth.UnauthorizedHandler;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Sends anonymous callers to the hub's login page instead of answering 401.
 * <p>
 * When the request is known the redirect carries {@code next}, so the hub can send the user back
 * after logging in. An absolute login location gets the full request URI, a relative one only the
 * path and query.
 */
public class HubLoginRedirectHandler implements UnauthorizedHandler {

  private final URI loginLocation;

  /**
   * Instantiates a new Hub login redirect handler.
   *
   * @param loginLocation the hub login page
   */
  public HubLoginRedirectHandler(URI loginLocation) {
    this.loginLocation = loginLocation;
  }

  @Override
  public Response buildResponse(String prefix, String realm) {
    return found(loginLocation);
  }

  /**
   * Redirects to the login page with the requested URI as {@code next}.
   *
   * @param requestContext the anonymous request
   * @return the 302 response
   */
  public Response buildResponse(ContainerRequestContext requestContext) {
    URI requestUri = requestContext.getUriInfo().getRequestUri();
    String next = loginLocation.isAbsolute() ? requestUri.toString() : pathAndQuery(requestUri);
    String separator = loginLocation.getRawQuery() == null ? "?" : "&";
    return found(URI.create(loginLocation + separator + "next="
        + URLEncoder.encode(next, StandardCharsets.UTF_8)));
  }

  private static String pathAndQuery(URI uri) {
    return uri.getRawQuery() == null ? uri.getRawPath() : uri.getRawPath() + "?" + uri.getRawQuery();
  }

  private static Response found(URI location) {
    return Response.status(Response.Status.FOUND).location(location).build();
  }
}
