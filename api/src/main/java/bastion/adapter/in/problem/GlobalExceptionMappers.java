package bastion.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import bastion.spi.StoreUnavailableException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>The login path never sees these: the attempt recorder recovers store failures
 * itself. They apply to administrative endpoints, which propagate store failures.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapStoreUnavailableException(StoreUnavailableException e) {
        LOG.warnv("Lockout store unavailable: {0}", e.getMessage());
        return toResponse(BastionProblem.storeUnavailable("Lockout store unavailable"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(BastionProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
