package bastion.adapter.in.http;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.vertx.core.http.HttpServerRequest;

import bastion.core.config.LockoutConfig;

/**
 * Resolves the client IP address of an inbound request.
 *
 * <p>Proxy headers are only honored when {@code bastion.lockout.behind-reverse-proxy} is
 * set; otherwise any client could pick its own scope key by sending a header. When honored,
 * RFC 7239 {@code Forwarded} takes precedence over {@code X-Forwarded-For}, and the first
 * (client-closest) entry wins.
 */
@ApplicationScoped
public class ClientIpResolver {

    private final boolean behindReverseProxy;

    @Inject
    public ClientIpResolver(LockoutConfig config) {
        this(config.behindReverseProxy());
    }

    ClientIpResolver(boolean behindReverseProxy) {
        this.behindReverseProxy = behindReverseProxy;
    }

    /**
     * Resolve the client IP of a Vert.x request.
     *
     * @param request the request
     * @return the client IP, or null if unknown
     */
    public String resolve(HttpServerRequest request) {
        final var remote = request.remoteAddress() != null ? request.remoteAddress().host() : null;
        return resolve(request.getHeader("Forwarded"), request.getHeader("X-Forwarded-For"), remote);
    }

    String resolve(String forwarded, String xForwardedFor, String remoteAddress) {
        if (behindReverseProxy) {
            if (forwarded != null) {
                final var ip = parseForwardedFor(forwarded);
                if (ip != null) {
                    return ip;
                }
            }
            if (xForwardedFor != null) {
                final var first = xForwardedFor.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        return remoteAddress;
    }

    /**
     * Parse the client IP from an RFC 7239 Forwarded header.
     *
     * @param forwarded the Forwarded header value
     * @return the client IP, or null if not found
     */
    static String parseForwardedFor(String forwarded) {
        final var firstEntry = forwarded.split(",")[0].trim();

        for (final var part : firstEntry.split(";")) {
            final var trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("for=")) {
                var value = trimmed.substring(4);
                if (value.startsWith("\"") && value.endsWith("\"") && value.length() >= 2) {
                    value = value.substring(1, value.length() - 1);
                }
                // [2001:db8::1]:4711
                if (value.startsWith("[")) {
                    final var bracketEnd = value.indexOf(']');
                    if (bracketEnd > 0) {
                        return value.substring(1, bracketEnd);
                    }
                }
                // IPv4 with port has exactly one colon
                final var colonCount = value.length() - value.replace(":", "").length();
                if (colonCount == 1) {
                    value = value.substring(0, value.indexOf(':'));
                }
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }
}
