package bastion.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import bastion.core.service.lockout.AttemptRecorder;

/**
 * REST resource for revoking trusted (username, ip) pairs.
 */
@Path("/admin/trust")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class TrustResource {

    private static final Logger LOG = Logger.getLogger(TrustResource.class);

    private final AttemptRecorder recorder;

    public TrustResource(AttemptRecorder recorder) {
        this.recorder = recorder;
    }

    /**
     * Revoke trust records. Omitted parameters match any value.
     *
     * @param username the username
     * @param ip the IP address
     * @return number of records revoked
     */
    @DELETE
    public Uni<Response> revoke(@QueryParam("username") String username, @QueryParam("ip") String ip) {
        LOG.infof("Revoking trust: username=%s, ip=%s", username, ip);
        return recorder.revokeTrust(username, ip).map(revoked -> Response.ok(Map.of("revoked", revoked)).build());
    }
}
