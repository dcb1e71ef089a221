package com.codeheadsystems.hubauth.dropwizard.errors;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.hubauth.client.exceptions.HubCredentialRejectedException;
import com.codeheadsystems.hubauth.client.exceptions.HubRequestRejectedException;
import com.codeheadsystems.hubauth.client.exceptions.HubUnavailableException;
import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class HubAccessorExceptionMapperTest {

  private final HubAccessorExceptionMapper mapper = new HubAccessorExceptionMapper();

  @Test
  void toResponse_unavailable_is502() {
    Response response = mapper.toResponse(new HubUnavailableException(new IOException("refused")));

    assertThat(response.getStatus()).isEqualTo(502);
    assertThat(response.getMediaType()).isEqualTo(MediaType.APPLICATION_JSON_TYPE);
    ErrorMessage body = (ErrorMessage) response.getEntity();
    assertThat(body.getCode()).isEqualTo(502);
    assertThat(body.getMessage()).isEqualTo(HubUnavailableException.MESSAGE);
  }

  @Test
  void toResponse_credentialRejected_is500WithRestartHint() {
    Response response = mapper.toResponse(new HubCredentialRejectedException());

    assertThat(response.getStatus()).isEqualTo(500);
    assertThat(((ErrorMessage) response.getEntity()).getMessage())
        .isEqualTo(HubCredentialRejectedException.MESSAGE);
  }

  @Test
  void toResponse_requestRejected_is500WithoutHubStatus() {
    Response response = mapper.toResponse(new HubRequestRejectedException(422));

    assertThat(response.getStatus()).isEqualTo(500);
    assertThat(((ErrorMessage) response.getEntity()).getMessage()).doesNotContain("422");
  }
}
