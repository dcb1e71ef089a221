package com.codeheadsystems.hubauth.dropwizard.resource;

import com.codeheadsystems.hubauth.server.auth.LogoutAction;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.core.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code GET /logout}: hands the browser to the {@link LogoutAction}, there is no local session to end.
 */
@Path("/logout")
public class LogoutResource {

  private static final Logger log = LoggerFactory.getLogger(LogoutResource.class);

  private final LogoutAction logoutAction;

  /**
   * Instantiates a new Logout resource.
   *
   * @param logoutAction the logout action
   */
  public LogoutResource(LogoutAction logoutAction) {
    this.logoutAction = logoutAction;
  }

  /**
   * Redirects to the logout location.
   *
   * @return the 302 response
   */
  @GET
  public Response logout() {
    log.debug("logout()");
    return Response.status(Response.Status.FOUND).location(logoutAction.logoutLocation()).build();
  }
}
