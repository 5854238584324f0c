package bastion.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;

import bastion.core.service.lockout.AttemptRecorder;

/**
 * REST resource exposing the login/logout audit trail, newest first.
 */
@Path("/admin/access-logs")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class AccessLogResource {

    private static final int DEFAULT_LIMIT = 100;

    private final AttemptRecorder recorder;

    public AccessLogResource(AttemptRecorder recorder) {
        this.recorder = recorder;
    }

    @GET
    public Uni<Response> list(@QueryParam("limit") Integer limit) {
        final var effectiveLimit = limit != null && limit > 0 ? limit : DEFAULT_LIMIT;
        return recorder.recentAccessLogs(effectiveLimit)
                .collect()
                .asList()
                .map(entries -> Response.ok(Map.of("entries", entries, "count", entries.size()))
                        .build());
    }
}
