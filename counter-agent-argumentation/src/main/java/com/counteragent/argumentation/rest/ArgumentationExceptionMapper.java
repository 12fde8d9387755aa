package com.counteragent.argumentation.rest;

import com.counteragent.argumentation.exceptions.ArgumentationException;
import com.counteragent.argumentation.rest.dto.ArgumentationError;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps engine errors to a 400 Bad Request response. They are caller errors or policy limits,
 * never server faults.
 */
@Provider
public class ArgumentationExceptionMapper implements ExceptionMapper<ArgumentationException> {
    @Override
    public Response toResponse(ArgumentationException exception) {
        Log.debugf(exception, "Argumentation request rejected");

        ArgumentationError error = new ArgumentationError(
                Response.Status.BAD_REQUEST.getStatusCode(),
                exception.getMessage(),
                String.format("Argumentation request rejected (%s)", exception.getClass().getSimpleName()));

        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(error)
                .build();
    }
}
