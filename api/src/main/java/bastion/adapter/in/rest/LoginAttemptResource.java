package bastion.adapter.in.rest;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import bastion.adapter.in.dto.AttemptResponse;
import bastion.adapter.in.dto.LoginAttemptRequest;
import bastion.adapter.in.dto.LogoutRequest;
import bastion.adapter.in.http.ClientIpResolver;
import bastion.adapter.in.problem.BastionProblem;
import bastion.core.model.lockout.AttemptOutcome;
import bastion.core.service.lockout.AttemptRecorder;

/**
 * REST resource used by authentication front ends to report login attempts.
 *
 * <p>The front end calls {@code POST /attempts} after checking credentials and refuses
 * the login when the answer is 429. {@code GET /attempts/status} may be called before
 * checking credentials to avoid the work for a locked client.
 */
@Path("/attempts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LoginAttemptResource {

    private static final int TOO_MANY_REQUESTS = 429;

    private final AttemptRecorder recorder;
    private final ClientIpResolver ipResolver;

    public LoginAttemptResource(AttemptRecorder recorder, ClientIpResolver ipResolver) {
        this.recorder = recorder;
        this.ipResolver = ipResolver;
    }

    /**
     * Record a login attempt and return the verdict.
     *
     * @param body the attempt
     * @param request the HTTP request, for IP and user agent fallback
     * @return 200 when allowed, 429 when locked
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> recordAttempt(LoginAttemptRequest body, @Context HttpServerRequest request) {
        if (body == null) {
            throw BastionProblem.badRequest("Request body is required");
        }
        final var attempt = body.toModel(ipResolver.resolve(request), request.getHeader("User-Agent"), Instant.now());
        return recorder.recordAttempt(attempt).map(LoginAttemptResource::toResponse);
    }

    /**
     * Check whether an attempt would be refused, without recording anything.
     *
     * @param username the username
     * @param ip the client IP (defaults to the caller's)
     * @param request the HTTP request
     * @return 200 when allowed, 429 when locked
     */
    @GET
    @Path("/status")
    public Uni<Response> status(
            @QueryParam("username") String username,
            @QueryParam("ip") String ip,
            @Context HttpServerRequest request) {
        final var address = ip != null && !ip.isBlank() ? ip : ipResolver.resolve(request);
        return recorder.checkLockout(username, address, request.getHeader("User-Agent"), Instant.now())
                .map(LoginAttemptResource::toResponse);
    }

    /**
     * Record the end of a session.
     *
     * @param body the logout
     * @param request the HTTP request, for IP fallback
     * @return 204 No Content
     */
    @POST
    @Path("/logout")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> logout(LogoutRequest body, @Context HttpServerRequest request) {
        if (body == null || body.username() == null || body.username().isBlank()) {
            throw BastionProblem.badRequest("username is required");
        }
        final var address =
                body.ipAddress() != null && !body.ipAddress().isBlank() ? body.ipAddress() : ipResolver.resolve(request);
        return recorder.recordLogout(body.username(), address, Instant.now())
                .map(closed -> Response.noContent().build());
    }

    static Response toResponse(AttemptOutcome outcome) {
        final var entity = AttemptResponse.fromModel(outcome);
        if (outcome.allowed()) {
            return Response.ok(entity).build();
        }
        final var builder = Response.status(TOO_MANY_REQUESTS).entity(entity);
        if (outcome.lockedUntil() != null) {
            final var seconds = Duration.between(Instant.now(), outcome.lockedUntil()).toSeconds();
            builder.header("Retry-After", Math.max(1, seconds));
        }
        return builder.build();
    }
}
