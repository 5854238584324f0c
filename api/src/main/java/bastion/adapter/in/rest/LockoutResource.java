package bastion.adapter.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.adapter.in.dto.ClearAllLockoutsRequest;
import bastion.adapter.in.dto.ScopeStatusDto;
import bastion.adapter.in.problem.BastionProblem;
import bastion.core.model.lockout.LockoutPolicy;
import bastion.core.model.lockout.ScopeStatus;
import bastion.core.service.lockout.AttemptRecorder;

/**
 * REST resource for lockout administration.
 *
 * <p>
 * Provides endpoints for:
 * <ul>
 * <li>Listing attempt records with their derived lockout state</li>
 * <li>Checking lockout status for specific IPs or usernames</li>
 * <li>Clearing attempt records (unlock)</li>
 * </ul>
 *
 * <p>
 * Authentication of these endpoints is left to the deployment (network policy or a
 * fronting proxy).
 */
@Path("/admin/lockouts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    private static final Logger LOG = Logger.getLogger(LockoutResource.class);

    private static final int DEFAULT_LIMIT = 100;

    private final AttemptRecorder recorder;
    private final LockoutPolicy policy;

    public LockoutResource(AttemptRecorder recorder, LockoutPolicy policy) {
        this.recorder = recorder;
        this.policy = policy;
    }

    /**
     * List attempt records.
     *
     * @param limit maximum number of entries to return
     * @return records with their lockout state
     */
    @GET
    public Uni<Response> listLockouts(@QueryParam("limit") Integer limit) {
        requireEnabled();
        final var effectiveLimit = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        final var now = Instant.now();

        return recorder.listScopes(now)
                .select()
                .first(effectiveLimit)
                .map(ScopeStatusDto::fromModel)
                .collect()
                .asList()
                .map(records -> Response.ok(Map.of(
                                "records", records,
                                "count", records.size(),
                                "locked", records.stream().filter(ScopeStatusDto::locked).count(),
                                "limit", effectiveLimit))
                        .build());
    }

    /**
     * Get lockout status for a specific IP address.
     *
     * @param ip the IP address to check
     * @return lockout status
     */
    @GET
    @Path("/ips/{ip}")
    public Uni<Response> getIpLockoutStatus(@PathParam("ip") String ip) {
        requireEnabled();
        return status("ip", ip, recorder.scopesForIp(ip, Instant.now()).collect().asList());
    }

    /**
     * Get lockout status for a specific username.
     *
     * @param username the username to check
     * @return lockout status
     */
    @GET
    @Path("/users/{username}")
    public Uni<Response> getUserLockoutStatus(@PathParam("username") String username) {
        requireEnabled();
        return status("user", username, recorder.scopesForUsername(username, Instant.now()).collect().asList());
    }

    /**
     * Clear every attempt record scoped to an IP address.
     *
     * @param ip the IP address to unlock
     * @return number of records cleared
     */
    @DELETE
    @Path("/ips/{ip}")
    public Uni<Response> clearIpLockout(@PathParam("ip") String ip) {
        requireEnabled();
        LOG.infof("Clearing IP lockout: ip=%s", ip);
        return recorder.reset(ip, null).map(cleared -> Response.ok(Map.of("cleared", cleared)).build());
    }

    /**
     * Clear every attempt record scoped to a username.
     *
     * @param username the username to unlock
     * @return number of records cleared
     */
    @DELETE
    @Path("/users/{username}")
    public Uni<Response> clearUserLockout(@PathParam("username") String username) {
        requireEnabled();
        LOG.infof("Clearing user lockout: username=%s", username);
        return recorder.reset(null, username).map(cleared -> Response.ok(Map.of("cleared", cleared)).build());
    }

    /**
     * Clear all attempt records (emergency use only).
     *
     * @param request request body with force flag
     * @return result with number of records cleared
     */
    @POST
    @Path(":reset")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> clearAllLockouts(ClearAllLockoutsRequest request) {
        requireEnabled();
        if (request == null || !request.force()) {
            throw BastionProblem.badRequest("Must set force=true to clear all lockouts");
        }

        LOG.warnf("Clearing ALL attempt records: reason=%s", request.reason());

        return recorder.reset(null, null).map(cleared -> Response.ok(Map.of(
                        "status", "cleared",
                        "cleared", cleared,
                        "clearedAt", Instant.now().toString()))
                .build());
    }

    private Uni<Response> status(String type, String value, Uni<List<ScopeStatus>> scopes) {
        return scopes.map(statuses -> {
            final var records = statuses.stream().map(ScopeStatusDto::fromModel).toList();
            final var response = new LinkedHashMap<String, Object>();
            response.put("type", type);
            response.put("value", value);
            response.put("locked", records.stream().anyMatch(ScopeStatusDto::locked));
            response.put("failureLimit", policy.failureLimit());
            response.put("records", records);
            response.put("checkedAt", Instant.now().toString());
            return Response.ok(response).build();
        });
    }

    private void requireEnabled() {
        if (!policy.enabled()) {
            throw BastionProblem.featureDisabled("Login lockout");
        }
    }
}
