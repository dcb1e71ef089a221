package com.codeheadsystems.hubauth.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import java.net.URI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HubLoginRedirectHandlerTest {

  private static final URI REQUEST = URI.create("http://localhost:8888/tree/work?sort=name");

  @Mock private ContainerRequestContext requestContext;
  @Mock private UriInfo uriInfo;

  @Test
  void buildResponse_isFoundToLoginPage() {
    URI login = URI.create("https://hub.example.org/hub/login");

    Response response = new HubLoginRedirectHandler(login).buildResponse("HubCookie", "realm");

    assertThat(response.getStatus()).isEqualTo(302);
    assertThat(response.getLocation()).isEqualTo(login);
    assertThat(response.hasEntity()).isFalse();
  }

  @Test
  void buildResponse_absoluteLogin_nextIsFullRequestUri() {
    givenRequest();

    Response response = new HubLoginRedirectHandler(URI.create("https://hub.example.org/hub/login"))
        .buildResponse(requestContext);

    assertThat(response.getStatus()).isEqualTo(302);
    assertThat(response.getLocation()).isEqualTo(URI.create(
        "https://hub.example.org/hub/login?next=http%3A%2F%2Flocalhost%3A8888%2Ftree%2Fwork%3Fsort%3Dname"));
  }

  @Test
  void buildResponse_relativeLogin_nextIsPathAndQuery() {
    givenRequest();

    Response response = new HubLoginRedirectHandler(URI.create("/hub/login")).buildResponse(requestContext);

    assertThat(response.getLocation()).isEqualTo(URI.create("/hub/login?next=%2Ftree%2Fwork%3Fsort%3Dname"));
  }

  @Test
  void buildResponse_loginWithQuery_appendsNext() {
    givenRequest();

    Response response = new HubLoginRedirectHandler(URI.create("/hub/login?theme=dark")).buildResponse(requestContext);

    assertThat(response.getLocation().toString()).isEqualTo("/hub/login?theme=dark&next=%2Ftree%2Fwork%3Fsort%3Dname");
  }

  private void givenRequest() {
    when(requestContext.getUriInfo()).thenReturn(uriInfo);
    when(uriInfo.getRequestUri()).thenReturn(REQUEST);
  }
}
