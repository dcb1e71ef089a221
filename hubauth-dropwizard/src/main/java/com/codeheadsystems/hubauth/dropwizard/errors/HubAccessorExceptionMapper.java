package com.codeheadsystems.hubauth.dropwizard.errors;

import com.codeheadsystems.hubauth.client.exceptions.HubAccessorException;
import io.dropwizard.jersey.errors.ErrorMessage;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Answers a classified hub failure with its status (500 or 502) and a generic message.
 * The failure itself was already logged where it was classified.
 */
@Provider
public class HubAccessorExceptionMapper implements ExceptionMapper<HubAccessorException> {

  @Override
  public Response toResponse(HubAccessorException exception) {
    return Response.status(exception.responseStatus())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorMessage(exception.responseStatus(), exception.getMessage()))
        .build();
  }
}
