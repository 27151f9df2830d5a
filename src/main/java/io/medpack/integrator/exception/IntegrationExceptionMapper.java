package io.medpack.integrator.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class IntegrationExceptionMapper implements ExceptionMapper<IntegrationException> {

    private static final Logger LOG = Logger.getLogger(IntegrationExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final IntegrationException exception) {
        final Response.StatusType status = statusOf(exception);
        if (status.getStatusCode() >= 500) {
            LOG.errorf(exception, "Integration failed: %s", exception.getMessage());
        } else {
            LOG.debugf("Integration rejected (%d): %s", status.getStatusCode(), exception.getMessage());
        }

        final ErrorResponse error = new ErrorResponse(
            "about:blank",
            status.getReasonPhrase(),
            status.getStatusCode(),
            exception.getMessage(),
            uriInfo != null ? uriInfo.getPath() : null,
            exception instanceof ValidationFailedException
                ? ((ValidationFailedException) exception).getReport()
                : null
        );

        return Response.status(status)
                .entity(error)
                .type("application/problem+json")
                .build();
    }

    static Response.StatusType statusOf(final IntegrationException exception) {
        if (exception instanceof ValidationFailedException) {
            return new UnprocessableEntity();
        }
        if (exception instanceof UnknownEntityReferenceException
                || exception instanceof UnknownDepartmentException
                || exception instanceof PackageLoadException
                || exception instanceof DirectiveFileException) {
            return Response.Status.BAD_REQUEST;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }

    private static final class UnprocessableEntity implements Response.StatusType {

        @Override
        public int getStatusCode() {
            return 422;
        }

        @Override
        public Response.Status.Family getFamily() {
            return Response.Status.Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Unprocessable Entity";
        }
    }
}
