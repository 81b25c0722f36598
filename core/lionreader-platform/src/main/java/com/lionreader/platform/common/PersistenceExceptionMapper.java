package com.lionreader.platform.common;

import jakarta.persistence.PersistenceException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Maps store failures that escape a resource to 503 temporarily_unavailable.
 * Callers may retry the whole request; the server never retries.
 */
@Provider
public class PersistenceExceptionMapper implements ExceptionMapper<PersistenceException> {

    private static final Logger LOG = Logger.getLogger(PersistenceExceptionMapper.class);

    @Override
    public Response toResponse(PersistenceException exception) {
        LOG.errorf(exception, "Store failure: %s", exception.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .entity(Map.of(
                "error", "temporarily_unavailable",
                "error_description", "The server is temporarily unable to handle the request"))
            .type(MediaType.APPLICATION_JSON)
            .header("Cache-Control", "no-store")
            .build();
    }
}
