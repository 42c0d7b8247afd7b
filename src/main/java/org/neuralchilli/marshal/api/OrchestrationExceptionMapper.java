package org.neuralchilli.marshal.api;

import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.RestResponse;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;
import org.neuralchilli.marshal.resource.ResourceDeniedException;
import org.neuralchilli.marshal.service.ConfigurationException;
import org.neuralchilli.marshal.service.OrchestrationException;
import org.neuralchilli.marshal.service.RunNotFoundException;
import org.neuralchilli.marshal.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps orchestration errors to HTTP responses carrying the error category and exit code.
 */
public class OrchestrationExceptionMapper {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationExceptionMapper.class);

    @ServerExceptionMapper
    public RestResponse<ApiError> mapOrchestration(OrchestrationException e) {
        Response.Status status = statusFor(e);
        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected ({}): {}", status.getStatusCode(), e.getMessage());
        }
        return RestResponse.status(status, new ApiError(
                status.getStatusCode(), e.category().name(), e.exitCode(), e.getMessage()));
    }

    @ServerExceptionMapper
    public RestResponse<ApiError> mapIllegalArgument(IllegalArgumentException e) {
        Response.Status status = Response.Status.BAD_REQUEST;
        return RestResponse.status(status, new ApiError(status.getStatusCode(), null, 2, e.getMessage()));
    }

    static Response.Status statusFor(OrchestrationException e) {
        if (e instanceof RunNotFoundException) {
            return Response.Status.NOT_FOUND;
        }
        if (e instanceof ValidationException) {
            return Response.Status.CONFLICT;
        }
        if (e instanceof ConfigurationException) {
            return Response.Status.BAD_REQUEST;
        }
        if (e instanceof ResourceDeniedException) {
            return Response.Status.TOO_MANY_REQUESTS;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }
}
