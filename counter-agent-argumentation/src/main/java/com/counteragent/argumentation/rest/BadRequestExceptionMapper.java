package com.counteragent.argumentation.rest;

import com.counteragent.argumentation.rest.dto.ArgumentationError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps malformed requests (unknown counter type, missing counter) to a 400 response with an
 * informative body.
 */
@Provider
public class BadRequestExceptionMapper implements ExceptionMapper<BadRequestException> {
    @Override
    public Response toResponse(BadRequestException exception) {
        Log.debugf(exception, "Bad request");

        ArgumentationError error = new ArgumentationError(
                Response.Status.BAD_REQUEST.getStatusCode(),
                exception.getMessage(),
                String.format("Bad request: %s", exception.getMessage()));

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }
}
