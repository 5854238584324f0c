package bastion.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import bastion.core.model.lockout.ScopeStatus;

/**
 * Administrative view of one attempt record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScopeStatusDto(
        String key,
        String scope,
        String username,
        String ipAddress,
        String userAgent,
        int failureCount,
        Instant firstFailureAt,
        Instant lastFailureAt,
        boolean locked,
        boolean expired,
        int remainingAttempts,
        Instant lockedUntil) {

    public static ScopeStatusDto fromModel(ScopeStatus status) {
        final var record = status.record();
        return new ScopeStatusDto(
                record.key(),
                record.scope().prefix(),
                record.username(),
                record.ipAddress(),
                record.userAgent(),
                record.failureCount(),
                record.firstFailureAt(),
                record.lastFailureAt(),
                status.locked(),
                status.expired(),
                status.remainingAttempts(),
                status.lockedUntil());
    }
}
