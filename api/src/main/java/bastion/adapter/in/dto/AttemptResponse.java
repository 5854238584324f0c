package bastion.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import bastion.core.model.lockout.AttemptOutcome;

/**
 * Gate verdict returned for a login attempt or a status check.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttemptResponse(
        String verdict,
        boolean locked,
        String reason,
        String key,
        int failureCount,
        int remainingAttempts,
        Instant lockedUntil,
        boolean trusted,
        String message) {

    public static final String LOCKED_MESSAGE = "Account locked: too many login attempts.";

    public static AttemptResponse fromModel(AttemptOutcome outcome) {
        final var locked = !outcome.allowed();
        return new AttemptResponse(
                outcome.verdict().name(),
                locked,
                outcome.reason(),
                outcome.key(),
                outcome.failureCount(),
                outcome.remainingAttempts(),
                outcome.lockedUntil(),
                outcome.trusted(),
                locked ? LOCKED_MESSAGE : null);
    }
}
